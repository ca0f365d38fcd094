package com.xbleey.grafanareporter.exception;

public class PersistenceException extends ReportException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
