package com.xbleey.grafanareporter.controller;

import com.xbleey.grafanareporter.exception.ReportValidationException;
import com.xbleey.grafanareporter.service.ReportEmailSender;
import com.xbleey.grafanareporter.service.ReportJobValidator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Sends a plain text message with the current SMTP settings, to check them before any job runs.
 */
@RestController
@RequestMapping("/test-email")
public class TestEmailController {

    static final String DEFAULT_SUBJECT = "Grafana Reporter test email";
    static final String DEFAULT_BODY = "This is a test email from the Grafana report scheduler.";

    private final ReportEmailSender emailSender;
    private final ReportJobValidator validator;

    public TestEmailController(ReportEmailSender emailSender, ReportJobValidator validator) {
        this.emailSender = emailSender;
        this.validator = validator;
    }

    @PostMapping
    public Map<String, Object> sendTestEmail(@RequestBody(required = false) TestEmailRequest request) {
        if (request == null) {
            throw new ReportValidationException("at least one recipient is required");
        }
        List<String> recipients = validator.normalizeRecipients(request.recipients());
        String subject = isBlank(request.subject()) ? DEFAULT_SUBJECT : request.subject();
        String body = isBlank(request.body()) ? DEFAULT_BODY : request.body();
        emailSender.sendText(recipients, subject, body);
        return Map.of(
                "message", "Test email sent successfully",
                "recipients", recipients
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record TestEmailRequest(List<String> recipients, String subject, String body) {
    }
}
