package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.exception.ReportJobNotFoundException;
import com.xbleey.grafanareporter.exception.ReportValidationException;
import com.xbleey.grafanareporter.model.ReportJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Job lifecycle. Every stored change and its matching scheduler call run under one write
 * lock, so the active registrations always mirror the store. Nothing under the lock talks
 * to Grafana or SMTP.
 */
@Service
public class ReportJobService {

    private static final Logger log = LoggerFactory.getLogger(ReportJobService.class);

    private final ReportJobStore jobStore;
    private final ReporterConfigStore configStore;
    private final ReportJobScheduler scheduler;
    private final ReportExecutionService executionService;
    private final ReportJobValidator validator;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ReportJobService(
            ReportJobStore jobStore,
            ReporterConfigStore configStore,
            ReportJobScheduler scheduler,
            ReportExecutionService executionService,
            ReportJobValidator validator,
            Clock clock
    ) {
        this.jobStore = jobStore;
        this.configStore = configStore;
        this.scheduler = scheduler;
        this.executionService = executionService;
        this.validator = validator;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        ReloadResult result = reload();
        log.info("Report scheduler started: {} jobs loaded, {} scheduled, {} skipped",
                result.jobsLoaded(), result.jobsScheduled(), result.jobsSkipped());
    }

    public List<ReportJob> list() {
        lock.readLock().lock();
        try {
            return jobStore.list();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ReportJob get(String id) {
        lock.readLock().lock();
        try {
            return jobStore.get(id).orElseThrow(() -> new ReportJobNotFoundException(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ReportJob create(ReportJob job) {
        ReportJob normalized = validator.normalize(job);
        ReportJob stored;
        lock.writeLock().lock();
        try {
            if (normalized.getId() == null || normalized.getId().isBlank()) {
                normalized.setId(generateId());
            } else if (jobStore.contains(normalized.getId())) {
                throw new ReportValidationException("Job already exists: " + normalized.getId());
            }
            stored = jobStore.put(normalized);
            scheduler.schedule(stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Created job {}", stored.getId());
        return stored;
    }

    public ReportJob update(String id, ReportJob job) {
        ReportJob normalized = validator.normalize(job);
        normalized.setId(id);
        ReportJob stored;
        lock.writeLock().lock();
        try {
            if (!jobStore.contains(id)) {
                throw new ReportJobNotFoundException(id);
            }
            stored = jobStore.put(normalized);
            scheduler.schedule(stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Updated job {}", id);
        return stored;
    }

    public void delete(String id) {
        lock.writeLock().lock();
        try {
            if (!jobStore.contains(id)) {
                throw new ReportJobNotFoundException(id);
            }
            scheduler.unschedule(id);
            jobStore.delete(id);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Deleted job {}", id);
    }

    public ExecutionAcknowledgement execute(String id) {
        return executionService.submit(get(id));
    }

    /**
     * Job id to cron expression for every live registration, read under the same lock as
     * the store.
     */
    public Map<String, String> activeSchedules() {
        lock.readLock().lock();
        try {
            return scheduler.activeRegistrations();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Re-reads both files and rebuilds every registration. Jobs whose cron no longer parses
     * stay stored but are not scheduled.
     */
    public ReloadResult reload() {
        configStore.reload();
        List<ReportJob> jobs;
        int cancelled;
        int scheduled = 0;
        int skipped = 0;
        lock.writeLock().lock();
        try {
            jobs = jobStore.reload();
            cancelled = scheduler.unscheduleAll();
            for (ReportJob job : jobs) {
                try {
                    scheduler.schedule(job);
                    scheduled++;
                } catch (RuntimeException ex) {
                    skipped++;
                    log.warn("Skipping job {}: {}", job.getId(), ex.getMessage());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Reload finished: cancelled={} loaded={} scheduled={} skipped={}",
                cancelled, jobs.size(), scheduled, skipped);
        return new ReloadResult(jobs.size(), scheduled, skipped);
    }

    private String generateId() {
        Instant now = clock.instant();
        long nanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
        String id = "job-" + nanos;
        while (jobStore.contains(id)) {
            nanos++;
            id = "job-" + nanos;
        }
        return id;
    }

    public record ReloadResult(int jobsLoaded, int jobsScheduled, int jobsSkipped) {
    }
}
