package com.xbleey.grafanareporter.exception;

public class EmailDeliveryException extends DownstreamException {

    public EmailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
