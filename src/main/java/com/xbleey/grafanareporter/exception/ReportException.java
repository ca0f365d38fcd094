package com.xbleey.grafanareporter.exception;

public abstract class ReportException extends RuntimeException {

    protected ReportException(String message) {
        super(message);
    }

    protected ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
