package com.xbleey.grafanareporter.controller;

import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.exception.ReportValidationException;
import com.xbleey.grafanareporter.service.ReportEmailSender;
import com.xbleey.grafanareporter.service.ReportJobValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class TestEmailControllerTest {

    private final ReportEmailSender emailSender = mock(ReportEmailSender.class);
    private final TestEmailController controller =
            new TestEmailController(emailSender, new ReportJobValidator(new ReportProperties()));

    @Test
    void sendsWithRequestSubjectAndBody() {
        Map<String, Object> response = controller.sendTestEmail(new TestEmailController.TestEmailRequest(
                List.of(" ops@example.com "), "SMTP check", "hello"));

        verify(emailSender).sendText(List.of("ops@example.com"), "SMTP check", "hello");
        assertThat(response).containsEntry("message", "Test email sent successfully");
    }

    @Test
    void fallsBackToDefaultSubjectAndBody() {
        controller.sendTestEmail(new TestEmailController.TestEmailRequest(List.of("ops@example.com"), null, ""));

        verify(emailSender).sendText(List.of("ops@example.com"),
                TestEmailController.DEFAULT_SUBJECT, TestEmailController.DEFAULT_BODY);
    }

    @Test
    void emptyRecipientsAreRejected() {
        assertThatThrownBy(() -> controller.sendTestEmail(
                new TestEmailController.TestEmailRequest(List.of(), "s", "b")))
                .isInstanceOf(ReportValidationException.class);
        assertThatThrownBy(() -> controller.sendTestEmail(null))
                .isInstanceOf(ReportValidationException.class);
        verifyNoInteractions(emailSender);
    }
}
