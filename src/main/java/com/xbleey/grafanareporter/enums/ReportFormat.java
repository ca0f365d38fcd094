package com.xbleey.grafanareporter.enums;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

@Getter
public enum ReportFormat {
    PNG("png", "image/png", false),
    PDF("pdf", "application/pdf", false),
    // rendered as PNG, embedded in the HTML body
    HTML("html", "image/png", true);

    private final String value;
    private final String contentType;
    private final boolean embedded;

    ReportFormat(String value, String contentType, boolean embedded) {
        this.value = value;
        this.contentType = contentType;
        this.embedded = embedded;
    }

    public static Optional<ReportFormat> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.value.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
