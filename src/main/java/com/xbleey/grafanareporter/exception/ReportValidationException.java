package com.xbleey.grafanareporter.exception;

public class ReportValidationException extends ReportException {

    public ReportValidationException(String message) {
        super(message);
    }

    public ReportValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
