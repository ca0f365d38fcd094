package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.model.ReportJob;
import com.xbleey.grafanareporter.repository.ReportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory job registry backed by the jobs file. Every mutation rewrites the whole file
 * before returning; a failed write is logged and the in-memory change is kept.
 */
@Service
public class ReportJobStore {

    private static final Logger log = LoggerFactory.getLogger(ReportJobStore.class);

    private final ReportJobRepository repository;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ReportJob> jobs = new LinkedHashMap<>();

    public ReportJobStore(ReportJobRepository repository) {
        this.repository = repository;
    }

    public List<ReportJob> list() {
        lock.readLock().lock();
        try {
            List<ReportJob> result = new ArrayList<>(jobs.size());
            for (ReportJob job : jobs.values()) {
                result.add(job.copy());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<ReportJob> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(jobs.get(id)).map(ReportJob::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String id) {
        if (id == null) {
            return false;
        }
        lock.readLock().lock();
        try {
            return jobs.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ReportJob put(ReportJob job) {
        if (job == null || job.getId() == null || job.getId().isBlank()) {
            throw new IllegalArgumentException("job id must not be blank");
        }
        ReportJob stored = job.copy();
        lock.writeLock().lock();
        try {
            jobs.put(stored.getId(), stored);
            persist();
        } finally {
            lock.writeLock().unlock();
        }
        return stored.copy();
    }

    public boolean delete(String id) {
        if (id == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            if (jobs.remove(id) == null) {
                return false;
            }
            persist();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the in-memory set with the file contents. On a read failure the current set
     * is kept and the error is rethrown.
     */
    public List<ReportJob> reload() {
        List<ReportJob> loaded = repository.loadAll();
        lock.writeLock().lock();
        try {
            jobs.clear();
            for (ReportJob job : loaded) {
                if (job == null || job.getId() == null || job.getId().isBlank()) {
                    log.warn("Skipping job without id in jobs file");
                    continue;
                }
                jobs.put(job.getId(), job);
            }
            log.info("Loaded {} jobs", jobs.size());
        } finally {
            lock.writeLock().unlock();
        }
        return list();
    }

    // caller holds the write lock
    private void persist() {
        try {
            repository.saveAll(new ArrayList<>(jobs.values()));
        } catch (RuntimeException ex) {
            log.error("Failed to save jobs", ex);
        }
    }
}
