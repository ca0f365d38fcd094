package com.xbleey.grafanareporter.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags each request with a trace id (from {@code traceparent}, {@code X-Trace-Id} or a new one)
 * and logs its start and end. Logged bodies never carry the API key or SMTP password.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
    static final String TRACE_ID_KEY = "trace.id";
    static final String TRACE_ID_HEADER = "X-Trace-Id";
    private static final String TRACEPARENT_HEADER = "traceparent";
    private static final int MAX_BODY_LENGTH = 2048;
    private static final Pattern TRACEPARENT_PATTERN = Pattern.compile(
            "^[\\da-f]{2}-([\\da-f]{32})-[\\da-f]{16}-[\\da-f]{2}$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SECRET_FIELD_PATTERN = Pattern.compile(
            "(\"(?:grafanaApiKey|smtpPassword)\"\\s*:\\s*)\"(?:[^\"\\\\]|\\\\.)*\""
    );

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveTraceId(request);
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        ContentCachingRequestWrapper wrappedRequest = wrapRequest(request);
        String method = wrappedRequest.getMethod();
        String path = wrappedRequest.getRequestURI();
        String query = Optional.ofNullable(wrappedRequest.getQueryString()).orElse("-");
        long startNanos = System.nanoTime();

        log.info("Request start: method={} path={} query={}", method, path, query);
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            log.info("Request end: method={} path={} status={} durationMs={} body={}",
                    method, path, response.getStatus(), durationMs, resolveBody(wrappedRequest));
            MDC.remove(TRACE_ID_KEY);
        }
    }

    static String redactSecrets(String payload) {
        return SECRET_FIELD_PATTERN.matcher(payload).replaceAll("$1\"[REDACTED]\"");
    }

    static String resolveTraceId(HttpServletRequest request) {
        String traceParent = request.getHeader(TRACEPARENT_HEADER);
        if (traceParent != null && !traceParent.isBlank()) {
            Matcher matcher = TRACEPARENT_PATTERN.matcher(traceParent.trim());
            if (matcher.matches()) {
                return matcher.group(1);
            }
        }
        String headerTraceId = request.getHeader(TRACE_ID_HEADER);
        if (headerTraceId != null && !headerTraceId.isBlank()) {
            return headerTraceId.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static ContentCachingRequestWrapper wrapRequest(HttpServletRequest request) {
        if (request instanceof ContentCachingRequestWrapper wrapped) {
            return wrapped;
        }
        return new ContentCachingRequestWrapper(request, MAX_BODY_LENGTH);
    }

    private static String resolveBody(ContentCachingRequestWrapper request) {
        String contentType = request.getContentType();
        if (contentType == null || !contentType.startsWith(MediaType.APPLICATION_JSON_VALUE)) {
            return "-";
        }
        byte[] content = request.getContentAsByteArray();
        if (content.length == 0) {
            return "-";
        }
        int length = Math.min(content.length, MAX_BODY_LENGTH);
        String payload = new String(content, 0, length, resolveCharset(request));
        payload = redactSecrets(payload.replaceAll("\\s+", " ").trim());
        if (content.length > MAX_BODY_LENGTH) {
            payload = payload + "...(" + content.length + " bytes)";
        }
        return payload.isEmpty() ? "-" : payload;
    }

    private static Charset resolveCharset(ContentCachingRequestWrapper request) {
        String encoding = Optional.ofNullable(request.getCharacterEncoding())
                .orElse(StandardCharsets.UTF_8.name());
        try {
            return Charset.forName(encoding);
        } catch (Exception ex) {
            return StandardCharsets.UTF_8;
        }
    }
}
