package com.xbleey.grafanareporter.exception;

public class DashboardListingException extends DownstreamException {

    public DashboardListingException(String message) {
        super(message);
    }

    public DashboardListingException(String message, Throwable cause) {
        super(message, cause);
    }
}
