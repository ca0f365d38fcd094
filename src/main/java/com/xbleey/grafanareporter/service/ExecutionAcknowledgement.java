package com.xbleey.grafanareporter.service;

import java.time.Instant;

public record ExecutionAcknowledgement(String jobId, Instant submittedAt, String message) {
}
