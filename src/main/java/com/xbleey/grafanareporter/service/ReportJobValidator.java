package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.enums.ReportFormat;
import com.xbleey.grafanareporter.exception.ReportValidationException;
import com.xbleey.grafanareporter.model.DashboardRef;
import com.xbleey.grafanareporter.model.RenderOptions;
import com.xbleey.grafanareporter.model.ReportJob;
import com.xbleey.grafanareporter.model.TimeRange;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies defaults to an incoming job and rejects it when it cannot be scheduled or delivered.
 */
@Component
public class ReportJobValidator {

    static final String DEFAULT_FROM = "now-24h";
    static final String DEFAULT_TO = "now";
    static final int DEFAULT_WIDTH = 1920;
    static final int DEFAULT_HEIGHT = 1080;
    static final int DEFAULT_SCALE = 1;
    static final String DEFAULT_SUBJECT = "Grafana Report";

    private final ZoneId zone;

    public ReportJobValidator(ReportProperties properties) {
        this.zone = properties.getZone();
    }

    /**
     * Returns a normalised copy of {@code job}; the argument is left untouched.
     */
    public ReportJob normalize(ReportJob job) {
        if (job == null) {
            throw new ReportValidationException("job body is required");
        }
        ReportJob normalized = job.copy();
        normalized.setCronExpression(trim(normalized.getCronExpression()));
        CronExpressions.parseSchedulable(normalized.getCronExpression(), zone);

        DashboardRef dashboard = normalized.getDashboardRef();
        dashboard.setUid(trim(dashboard.getUid()));
        dashboard.setSlug(trim(dashboard.getSlug()));
        if (dashboard.getUid().isEmpty()) {
            throw new ReportValidationException("dashboardUid is required");
        }
        if (dashboard.getSlug().isEmpty()) {
            throw new ReportValidationException("slug is required");
        }

        String format = trim(normalized.getFormat()).toLowerCase(Locale.ROOT);
        if (format.isEmpty()) {
            format = ReportFormat.PNG.getValue();
        }
        if (ReportFormat.fromValue(format).isEmpty()) {
            throw new ReportValidationException("Unsupported format: " + normalized.getFormat()
                    + " (expected png, pdf or html)");
        }
        normalized.setFormat(format);

        normalized.setRecipients(normalizeRecipients(normalized.getRecipients()));
        normalized.setVariables(normalizeVariables(normalized.getVariables()));

        TimeRange range = normalized.getTimeRange();
        if (trim(range.getFrom()).isEmpty()) {
            range.setFrom(DEFAULT_FROM);
        }
        if (trim(range.getTo()).isEmpty()) {
            range.setTo(DEFAULT_TO);
        }
        RenderOptions options = normalized.getRenderOptions();
        if (options.getWidth() <= 0) {
            options.setWidth(DEFAULT_WIDTH);
        }
        if (options.getHeight() <= 0) {
            options.setHeight(DEFAULT_HEIGHT);
        }
        if (options.getScale() <= 0) {
            options.setScale(DEFAULT_SCALE);
        }
        if (trim(normalized.getSubject()).isEmpty()) {
            normalized.setSubject(DEFAULT_SUBJECT);
        }
        if (normalized.getBody() == null) {
            normalized.setBody("");
        }
        return normalized;
    }

    public List<String> normalizeRecipients(List<String> recipients) {
        List<String> result = new ArrayList<>();
        if (recipients != null) {
            for (String recipient : recipients) {
                String value = trim(recipient);
                if (value.isEmpty()) {
                    continue;
                }
                try {
                    new InternetAddress(value, true);
                } catch (AddressException ex) {
                    throw new ReportValidationException("Invalid recipient address: " + value, ex);
                }
                result.add(value);
            }
        }
        if (result.isEmpty()) {
            throw new ReportValidationException("at least one recipient is required");
        }
        return result;
    }

    private static Map<String, List<String>> normalizeVariables(Map<String, List<String>> variables) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        variables.forEach((name, values) -> {
            String key = trim(name);
            if (key.isEmpty()) {
                throw new ReportValidationException("variable name must not be blank");
            }
            result.put(key, values == null ? new ArrayList<>() : new ArrayList<>(values));
        });
        return result;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
