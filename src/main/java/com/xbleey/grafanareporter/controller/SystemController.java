package com.xbleey.grafanareporter.controller;

import com.xbleey.grafanareporter.service.ReportJobScheduler;
import com.xbleey.grafanareporter.service.ReportJobService;
import org.springframework.boot.info.BuildProperties;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class SystemController {

    static final String APPLICATION_NAME = "grafana-report-scheduler";

    private final ReportJobService jobService;
    private final ReportJobScheduler scheduler;
    private final Clock clock;
    @Nullable
    private final BuildProperties buildProperties;
    private final Instant startedAt;

    public SystemController(
            ReportJobService jobService,
            ReportJobScheduler scheduler,
            Clock clock,
            @Nullable BuildProperties buildProperties
    ) {
        this.jobService = jobService;
        this.scheduler = scheduler;
        this.clock = clock;
        this.buildProperties = buildProperties;
        this.startedAt = Instant.now(clock);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "UP",
                "timestamp", Instant.now(clock).toString(),
                "scheduledJobs", jobService.activeSchedules().size()
        );
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        Instant now = Instant.now(clock);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", buildProperties == null ? APPLICATION_NAME : buildProperties.getName());
        body.put("version", buildProperties == null ? "unknown" : buildProperties.getVersion());
        body.put("buildTime", buildProperties == null || buildProperties.getTime() == null
                ? null
                : buildProperties.getTime().toString());
        body.put("startedAt", startedAt.toString());
        body.put("uptimeSeconds", Duration.between(startedAt, now).getSeconds());
        body.put("scheduledJobs", jobService.activeSchedules().size());
        Map<String, String> nextRuns = new LinkedHashMap<>();
        scheduler.nextExecutions().forEach((id, next) -> nextRuns.put(id, next.toOffsetDateTime().toString()));
        body.put("nextRuns", nextRuns);
        return body;
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        ReportJobService.ReloadResult result = jobService.reload();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Reloaded successfully");
        body.put("jobsLoaded", result.jobsLoaded());
        body.put("jobsScheduled", result.jobsScheduled());
        body.put("jobsSkipped", result.jobsSkipped());
        return body;
    }
}
