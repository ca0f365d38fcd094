package com.xbleey.grafanareporter.repository;

import com.xbleey.grafanareporter.model.ReporterConfig;

import java.util.Optional;

public interface ReporterConfigRepository {

    Optional<ReporterConfig> load();

    void save(ReporterConfig config);
}
