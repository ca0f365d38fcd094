package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportDefaultsProperties;
import com.xbleey.grafanareporter.exception.PersistenceException;
import com.xbleey.grafanareporter.model.ReporterConfig;
import com.xbleey.grafanareporter.repository.ReporterConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Singleton Grafana/SMTP settings. Has its own lock, never taken together with the job
 * store's. External readers only get the masked view.
 */
@Service
public class ReporterConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ReporterConfigStore.class);

    private final ReporterConfigRepository repository;
    private final ReportDefaultsProperties defaults;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ReporterConfig config = new ReporterConfig();

    public ReporterConfigStore(ReporterConfigRepository repository, ReportDefaultsProperties defaults) {
        this.repository = repository;
        this.defaults = defaults;
    }

    public ReporterConfig read() {
        return masked(current());
    }

    /**
     * Cleartext copy for in-process collaborators (render, listing and mail clients).
     */
    public ReporterConfig current() {
        lock.readLock().lock();
        try {
            return config.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the stored settings. A secret field carrying a masked placeholder keeps the
     * stored secret. The in-memory value stays updated even when writing the file fails.
     */
    public ReporterConfig update(ReporterConfig incoming) {
        if (incoming == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        ReporterConfig merged = incoming.copy();
        lock.writeLock().lock();
        try {
            if (SecretMasker.isMasked(merged.getGrafanaApiKey())) {
                merged.setGrafanaApiKey(config.getGrafanaApiKey());
            }
            if (SecretMasker.isMasked(merged.getSmtpPassword())) {
                merged.setSmtpPassword(config.getSmtpPassword());
            }
            config = merged;
            repository.save(merged);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Configuration saved (grafanaUrl={}, smtpHost={}:{})",
                merged.getGrafanaUrl(), merged.getSmtpHost(), merged.getSmtpPort());
        return masked(merged);
    }

    /**
     * Re-reads the config file and fills empty fields from the environment defaults.
     * A missing or unreadable file leaves only the defaults.
     */
    public ReporterConfig reload() {
        ReporterConfig loaded;
        try {
            loaded = repository.load().orElseGet(ReporterConfig::new);
        } catch (PersistenceException ex) {
            log.warn("Failed to load config, falling back to defaults", ex);
            loaded = new ReporterConfig();
        }
        applyDefaults(loaded);
        lock.writeLock().lock();
        try {
            config = loaded;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded configuration (grafanaUrl={}, smtpHost={})", loaded.getGrafanaUrl(), loaded.getSmtpHost());
        return masked(loaded);
    }

    private void applyDefaults(ReporterConfig target) {
        if (isBlank(target.getGrafanaUrl())) {
            target.setGrafanaUrl(isBlank(defaults.getGrafanaUrl())
                    ? "http://localhost:3000"
                    : defaults.getGrafanaUrl().trim());
        }
        if (isBlank(target.getSmtpHost())) {
            target.setSmtpHost(defaults.getSmtpHost());
        }
        if (target.getSmtpPort() <= 0) {
            target.setSmtpPort(parsePort(defaults.getSmtpPort()));
        }
        if (isBlank(target.getSmtpUser())) {
            target.setSmtpUser(defaults.getSmtpUser());
        }
        if (isBlank(target.getSmtpPassword())) {
            target.setSmtpPassword(defaults.getSmtpPassword());
        }
        if (isBlank(target.getSmtpFrom())) {
            target.setSmtpFrom(isBlank(defaults.getSmtpFrom()) ? target.getSmtpUser() : defaults.getSmtpFrom());
        }
    }

    private static int parsePort(String value) {
        if (isBlank(value)) {
            return ReportDefaultsProperties.DEFAULT_SMTP_PORT;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            log.warn("Invalid SMTP port '{}', using default {}", value, ReportDefaultsProperties.DEFAULT_SMTP_PORT);
            return ReportDefaultsProperties.DEFAULT_SMTP_PORT;
        }
    }

    private static ReporterConfig masked(ReporterConfig source) {
        ReporterConfig view = source.copy();
        view.setGrafanaApiKey(SecretMasker.mask(source.getGrafanaApiKey()));
        view.setSmtpPassword(SecretMasker.mask(source.getSmtpPassword()));
        return view;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
