package com.xbleey.grafanareporter.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

@Data
@Component
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    private Path jobsFile;
    private Path configFile;
    private Duration renderTimeout = Duration.ofSeconds(60);
    private Duration dashboardsTimeout = Duration.ofSeconds(30);
    private Duration smtpTimeout = Duration.ofSeconds(30);
    private int schedulerPoolSize = 4;
    private int executionPoolSize = 2;
    private ZoneId zone = ZoneId.systemDefault();

    @PostConstruct
    public void validate() {
        if (jobsFile == null) {
            throw new IllegalStateException("report.jobs-file must be configured");
        }
        if (configFile == null) {
            throw new IllegalStateException("report.config-file must be configured");
        }
        requirePositive("report.render-timeout", renderTimeout);
        requirePositive("report.dashboards-timeout", dashboardsTimeout);
        requirePositive("report.smtp-timeout", smtpTimeout);
        if (schedulerPoolSize < 1) {
            throw new IllegalStateException("report.scheduler-pool-size must be >= 1");
        }
        if (executionPoolSize < 1) {
            throw new IllegalStateException("report.execution-pool-size must be >= 1");
        }
    }

    private static void requirePositive(String name, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalStateException(name + " must be > 0");
        }
    }
}
