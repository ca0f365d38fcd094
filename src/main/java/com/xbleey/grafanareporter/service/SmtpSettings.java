package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportDefaultsProperties;
import com.xbleey.grafanareporter.exception.ConfigurationMissingException;
import com.xbleey.grafanareporter.model.ReporterConfig;

import java.time.Duration;

public record SmtpSettings(String host, int port, String username, String password, String from, Duration timeout) {

    public static SmtpSettings from(ReporterConfig config, Duration timeout) {
        String host = trimToNull(config.getSmtpHost());
        if (host == null) {
            throw new ConfigurationMissingException("SMTP host not configured");
        }
        int port = config.getSmtpPort() > 0 ? config.getSmtpPort() : ReportDefaultsProperties.DEFAULT_SMTP_PORT;
        String username = trimToNull(config.getSmtpUser());
        String from = trimToNull(config.getSmtpFrom());
        if (from == null) {
            from = username;
        }
        if (from == null) {
            throw new ConfigurationMissingException("SMTP from address not configured");
        }
        return new SmtpSettings(host, port, username, config.getSmtpPassword(), from, timeout);
    }

    public boolean authenticated() {
        return username != null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
