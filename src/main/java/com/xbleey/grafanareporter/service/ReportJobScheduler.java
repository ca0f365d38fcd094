package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.model.ReportJob;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keeps at most one cron registration per job id.
 * <p>
 * Each registration runs an immutable copy of the job taken when {@link #schedule} was called.
 * Later edits to the job are invisible to the registration, so every change must be followed
 * by another {@code schedule} call. Replacing a registration does not wait for a run of the
 * old one that is already in flight.
 */
@Service
public class ReportJobScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReportJobScheduler.class);

    private final TaskScheduler taskScheduler;
    private final ReportExecutionService executionService;
    private final ZoneId zone;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Registration> registrations = new HashMap<>();

    public ReportJobScheduler(
            TaskScheduler taskScheduler,
            ReportExecutionService executionService,
            ReportProperties properties,
            Clock clock
    ) {
        this.taskScheduler = taskScheduler;
        this.executionService = executionService;
        this.zone = properties.getZone();
        this.clock = clock;
    }

    /**
     * Registers {@code job} under its cron expression, cancelling any previous registration
     * for the same id. A malformed expression fails before anything is cancelled.
     */
    public void schedule(ReportJob job) {
        if (job == null || job.getId() == null || job.getId().isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        CronExpression cron = CronExpressions.parseSchedulable(job.getCronExpression(), zone);
        ReportJob snapshot = job.copy();
        String springExpression = CronExpressions.toSpringExpression(snapshot.getCronExpression());
        lock.writeLock().lock();
        try {
            Registration previous = registrations.remove(snapshot.getId());
            if (previous != null) {
                previous.handle().cancel(false);
            }
            ScheduledFuture<?> handle = taskScheduler.schedule(
                    new ScheduledReportTask(snapshot, executionService),
                    new CronTrigger(springExpression, zone)
            );
            if (handle == null) {
                log.warn("Cron expression for job {} has no upcoming run, not scheduled", snapshot.getId());
                return;
            }
            registrations.put(snapshot.getId(), new Registration(handle, snapshot.getCronExpression(), cron));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Scheduled job {} with cron '{}'", snapshot.getId(), snapshot.getCronExpression());
    }

    public void unschedule(String jobId) {
        if (jobId == null) {
            return;
        }
        Registration removed;
        lock.writeLock().lock();
        try {
            removed = registrations.remove(jobId);
            if (removed != null) {
                removed.handle().cancel(false);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.info("Unscheduled job {}", jobId);
        }
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = unscheduleAll();
        log.info("Cancelled {} job registrations on shutdown", cancelled);
    }

    public int unscheduleAll() {
        lock.writeLock().lock();
        try {
            int count = registrations.size();
            registrations.values().forEach(registration -> registration.handle().cancel(false));
            registrations.clear();
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Job id to cron expression for every live registration, ordered by id.
     */
    public Map<String, String> activeRegistrations() {
        lock.readLock().lock();
        try {
            Map<String, String> result = new TreeMap<>();
            registrations.forEach((id, registration) -> result.put(id, registration.expression()));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Next fire time of every live registration in the configured zone, ordered by id.
     * Registrations whose cron has no further match are left out.
     */
    public Map<String, ZonedDateTime> nextExecutions() {
        Map<String, CronExpression> crons = new TreeMap<>();
        lock.readLock().lock();
        try {
            registrations.forEach((id, registration) -> crons.put(id, registration.cron()));
        } finally {
            lock.readLock().unlock();
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        Map<String, ZonedDateTime> result = new TreeMap<>();
        crons.forEach((id, cron) -> {
            ZonedDateTime next = cron.next(now);
            if (next != null) {
                result.put(id, next);
            }
        });
        return result;
    }

    private record Registration(ScheduledFuture<?> handle, String expression, CronExpression cron) {
    }

    private record ScheduledReportTask(ReportJob snapshot, ReportExecutionService executionService)
            implements Runnable {

        @Override
        public void run() {
            executionService.runScheduled(snapshot);
        }

        @Override
        public String toString() {
            return "ScheduledReportTask[" + snapshot.getId() + "]";
        }
    }
}
