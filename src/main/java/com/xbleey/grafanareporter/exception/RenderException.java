package com.xbleey.grafanareporter.exception;

import lombok.Getter;

@Getter
public class RenderException extends DownstreamException {

    /**
     * HTTP status returned by the render endpoint, or -1 when no response was received.
     */
    private final int status;

    public RenderException(int status, String responseBody) {
        super("render request failed with status " + status + ": " + responseBody);
        this.status = status;
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }
}
