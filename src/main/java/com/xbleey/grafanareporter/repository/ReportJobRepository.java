package com.xbleey.grafanareporter.repository;

import com.xbleey.grafanareporter.model.ReportJob;

import java.util.Collection;
import java.util.List;

public interface ReportJobRepository {

    List<ReportJob> loadAll();

    void saveAll(Collection<ReportJob> jobs);
}
