package com.xbleey.grafanareporter.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    void redactsSecretFields() {
        String body = "{\"grafanaUrl\":\"http://g\",\"grafanaApiKey\":\"glsa_secret\",\"smtpPassword\" : \"p\\\"w\"}";

        String redacted = RequestLoggingFilter.redactSecrets(body);

        assertThat(redacted)
                .contains("\"grafanaUrl\":\"http://g\"")
                .contains("\"grafanaApiKey\":\"[REDACTED]\"")
                .contains("\"smtpPassword\" : \"[REDACTED]\"")
                .doesNotContain("glsa_secret");
    }

    @Test
    void usesTraceparentTraceId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/jobs");
        request.addHeader("traceparent", "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> traceInChain = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(jakarta.servlet.ServletRequest req, jakarta.servlet.ServletResponse res) {
                traceInChain.set(MDC.get("trace.id"));
            }
        });

        assertThat(traceInChain.get()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(response.getHeader("X-Trace-Id")).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(MDC.get("trace.id")).isNull();
    }

    @Test
    void generatesTraceIdWhenAbsent() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/config");
        request.setContentType("application/json");
        request.setContent("{\"smtpPassword\":\"x\"}".getBytes());
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader("X-Trace-Id")).matches("[0-9a-f]{32}");
    }
}
