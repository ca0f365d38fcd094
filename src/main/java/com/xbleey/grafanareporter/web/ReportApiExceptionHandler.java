package com.xbleey.grafanareporter.web;

import com.xbleey.grafanareporter.exception.ConfigurationMissingException;
import com.xbleey.grafanareporter.exception.DownstreamException;
import com.xbleey.grafanareporter.exception.PersistenceException;
import com.xbleey.grafanareporter.exception.ReportJobNotFoundException;
import com.xbleey.grafanareporter.exception.ReportValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@code {status, error, message, timestamp}} bodies.
 */
@RestControllerAdvice
public class ReportApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReportApiExceptionHandler.class);

    private final Clock clock;

    public ReportApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(ReportValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ReportValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "validation", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable request body", ex);
        return respond(HttpStatus.BAD_REQUEST, "validation", "Malformed JSON request body");
    }

    @ExceptionHandler(ReportJobNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ReportJobNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(DownstreamException.class)
    public ResponseEntity<Map<String, Object>> handleDownstream(DownstreamException ex) {
        log.warn("Downstream call failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, "downstream", ex.getMessage());
    }

    @ExceptionHandler(ConfigurationMissingException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationMissingException ex) {
        log.warn("Configuration incomplete: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "configuration", ex.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(PersistenceException ex) {
        log.error("Persistence failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "persistence", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            return handleRejectedRequest(ex, errorResponse);
        }
        log.error("Unhandled request failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error");
    }

    /**
     * Spring MVC's own client errors (unknown path, wrong method, unsupported media type)
     * keep their status and headers such as {@code Allow}.
     */
    private ResponseEntity<Map<String, Object>> handleRejectedRequest(Exception ex, ErrorResponse errorResponse) {
        HttpStatusCode status = errorResponse.getStatusCode();
        log.debug("Rejected request with status {}: {}", status.value(), ex.getMessage());
        String error = status.value() == HttpStatus.NOT_FOUND.value() ? "not_found" : "validation";
        String message = errorResponse.getBody().getDetail();
        if (message == null || message.isBlank()) {
            message = ex.getMessage();
        }
        return respond(status, errorResponse.getHeaders(), error, message);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        return respond(status, HttpHeaders.EMPTY, error, message);
    }

    private ResponseEntity<Map<String, Object>> respond(
            HttpStatusCode status,
            HttpHeaders headers,
            String error,
            String message
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.status(status).headers(headers).body(body);
    }
}
