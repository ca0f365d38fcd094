package com.xbleey.grafanareporter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connection settings for Grafana and SMTP. {@code grafanaApiKey} and {@code smtpPassword}
 * are secrets and only leave the process masked.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReporterConfig {

    private String grafanaUrl;
    private String grafanaApiKey;
    private String smtpHost;
    private int smtpPort;
    private String smtpUser;
    private String smtpPassword;
    private String smtpFrom;

    public ReporterConfig copy() {
        return toBuilder().build();
    }
}
