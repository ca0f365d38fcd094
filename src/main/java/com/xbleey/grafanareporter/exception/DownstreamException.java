package com.xbleey.grafanareporter.exception;

/**
 * A call to Grafana or the SMTP server failed. Never retried.
 */
public abstract class DownstreamException extends ReportException {

    protected DownstreamException(String message) {
        super(message);
    }

    protected DownstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
