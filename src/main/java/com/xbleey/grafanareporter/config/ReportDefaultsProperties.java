package com.xbleey.grafanareporter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Fallback connection settings, normally bound from the {@code GRAFANA_URL} and
 * {@code SMTP_*} environment variables. They only fill fields the persisted config leaves empty.
 */
@Data
@Component
@ConfigurationProperties(prefix = "report.defaults")
public class ReportDefaultsProperties {

    public static final int DEFAULT_SMTP_PORT = 587;

    private String grafanaUrl = "http://localhost:3000";
    private String smtpHost;
    private String smtpPort;
    private String smtpUser;
    private String smtpPassword;
    private String smtpFrom;
}
