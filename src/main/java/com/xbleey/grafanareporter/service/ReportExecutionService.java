package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.model.ReportJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * One report run: render the snapshot, then mail it. Any failure aborts the run.
 */
@Service
public class ReportExecutionService {

    private static final Logger log = LoggerFactory.getLogger(ReportExecutionService.class);
    static final String JOB_ID_KEY = "job.id";
    static final String STARTED_MESSAGE = "Job execution started";

    private final GrafanaRenderClient renderClient;
    private final ReportEmailSender emailSender;
    private final AsyncTaskExecutor executor;
    private final Clock clock;

    public ReportExecutionService(
            GrafanaRenderClient renderClient,
            ReportEmailSender emailSender,
            @Qualifier("reportExecutionExecutor") AsyncTaskExecutor executor,
            Clock clock
    ) {
        this.renderClient = renderClient;
        this.emailSender = emailSender;
        this.executor = executor;
        this.clock = clock;
    }

    public void execute(ReportJob job) {
        String previous = MDC.get(JOB_ID_KEY);
        MDC.put(JOB_ID_KEY, job.getId());
        try {
            long startNanos = System.nanoTime();
            log.info("Executing report job {} (dashboard={}, format={})",
                    job.getId(), job.getDashboardRef().getUid(), job.getFormat());
            RenderedReport report = renderClient.render(job);
            emailSender.sendReport(job, report);
            log.info("Report job {} delivered to {} recipient(s) in {}ms",
                    job.getId(), job.getRecipients().size(), (System.nanoTime() - startNanos) / 1_000_000);
        } finally {
            if (previous == null) {
                MDC.remove(JOB_ID_KEY);
            } else {
                MDC.put(JOB_ID_KEY, previous);
            }
        }
    }

    /**
     * Starts a detached run and returns at once. The outcome only shows up in the log.
     */
    public ExecutionAcknowledgement submit(ReportJob job) {
        ReportJob snapshot = job.copy();
        Instant submittedAt = clock.instant();
        executor.execute(() -> runSafely(snapshot, "On-demand"));
        log.info("Submitted on-demand run for job {}", snapshot.getId());
        return new ExecutionAcknowledgement(snapshot.getId(), submittedAt, STARTED_MESSAGE);
    }

    /**
     * Cron entry point. Failures are logged so the registration keeps firing.
     */
    public void runScheduled(ReportJob job) {
        runSafely(job, "Scheduled");
    }

    private void runSafely(ReportJob job, String trigger) {
        try {
            execute(job);
        } catch (RuntimeException ex) {
            log.error("{} run of job {} failed: {}", trigger, job.getId(), ex.getMessage(), ex);
        }
    }
}
