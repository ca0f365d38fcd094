package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportDefaultsProperties;
import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.enums.ReportFormat;
import com.xbleey.grafanareporter.exception.ConfigurationMissingException;
import com.xbleey.grafanareporter.exception.EmailDeliveryException;
import com.xbleey.grafanareporter.model.ReportJob;
import com.xbleey.grafanareporter.model.ReporterConfig;
import com.xbleey.grafanareporter.support.InMemoryReporterConfigRepository;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;

import static com.xbleey.grafanareporter.support.ReportJobs.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ReportEmailSenderTest {

    private JavaMailSender mailSender;
    private SmtpMailSenderFactory mailSenderFactory;
    private MimeMessage mimeMessage;

    @BeforeEach
    void setUp() {
        mailSender = mock(JavaMailSender.class);
        mimeMessage = new MimeMessage(Session.getInstance(new Properties()));
        when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
        mailSenderFactory = mock(SmtpMailSenderFactory.class);
        when(mailSenderFactory.create(any())).thenReturn(mailSender);
    }

    private ReportEmailSender sender(ReporterConfig config) {
        ReporterConfigStore configStore = new ReporterConfigStore(
                new InMemoryReporterConfigRepository(config), new ReportDefaultsProperties());
        configStore.reload();
        Clock clock = Clock.fixed(Instant.parse("2026-01-05T08:30:00Z"), ZoneOffset.UTC);
        return new ReportEmailSender(configStore, mailSenderFactory, new ReportEmailComposer(clock),
                new ReportProperties());
    }

    private static ReporterConfig smtpConfig() {
        return ReporterConfig.builder()
                .smtpHost("smtp.example.com")
                .smtpPort(0)
                .smtpUser("robot@example.com")
                .smtpPassword("pw")
                .build();
    }

    @Test
    void sendsHtmlReportInEmbeddedMode() throws Exception {
        ReportJob job = job("job-1", "0 8 * * *");
        job.setFormat("html");

        sender(smtpConfig()).sendReport(job, new RenderedReport(new byte[]{1, 2, 3}, ReportFormat.HTML));

        verify(mailSender).send(mimeMessage);
        assertThat(mimeMessage.isMimeType("multipart/alternative")).isTrue();
        assertThat(mimeMessage.getFrom()).containsExactly(new InternetAddress("robot@example.com"));
        assertThat(mimeMessage.getSubject()).isEqualTo("Daily ops");

        ArgumentCaptor<SmtpSettings> settings = ArgumentCaptor.forClass(SmtpSettings.class);
        verify(mailSenderFactory).create(settings.capture());
        assertThat(settings.getValue().port()).isEqualTo(587);
        assertThat(settings.getValue().authenticated()).isTrue();
    }

    @Test
    void sendsPngReportAsAttachment() throws Exception {
        sender(smtpConfig()).sendReport(job("job-1", "0 8 * * *"),
                new RenderedReport(new byte[]{1, 2, 3}, ReportFormat.PNG));

        assertThat(mimeMessage.isMimeType("multipart/mixed")).isTrue();
    }

    @Test
    void sendFailureBecomesDeliveryError() {
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(MimeMessage.class));

        assertThatThrownBy(() -> sender(smtpConfig()).sendText(List.of("ops@example.com"), "Test", "Body"))
                .isInstanceOf(EmailDeliveryException.class)
                .hasMessageContaining("smtp.example.com:587")
                .hasMessageContaining("connection refused");
    }

    @Test
    void missingHostFailsBeforeConnecting() {
        ReporterConfig config = smtpConfig();
        config.setSmtpHost(" ");

        assertThatThrownBy(() -> sender(config).sendText(List.of("ops@example.com"), "Test", "Body"))
                .isInstanceOf(ConfigurationMissingException.class);
        verifyNoInteractions(mailSenderFactory);
        verify(mailSender, never()).send(any(MimeMessage.class));
    }
}
