package com.xbleey.grafanareporter.exception;

import lombok.Getter;

@Getter
public class ReportJobNotFoundException extends ReportException {

    private final String jobId;

    public ReportJobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }
}
