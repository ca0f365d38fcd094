package com.xbleey.grafanareporter.exception;

public class ConfigurationMissingException extends ReportException {

    public ConfigurationMissingException(String message) {
        super(message);
    }
}
