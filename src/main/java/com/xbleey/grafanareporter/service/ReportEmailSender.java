package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportProperties;
import com.xbleey.grafanareporter.exception.EmailDeliveryException;
import com.xbleey.grafanareporter.model.ReportJob;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Delivers composed messages over SMTP, synchronously and without retry.
 */
@Service
public class ReportEmailSender {

    private static final Logger log = LoggerFactory.getLogger(ReportEmailSender.class);

    private final ReporterConfigStore configStore;
    private final SmtpMailSenderFactory mailSenderFactory;
    private final ReportEmailComposer composer;
    private final Duration timeout;

    public ReportEmailSender(
            ReporterConfigStore configStore,
            SmtpMailSenderFactory mailSenderFactory,
            ReportEmailComposer composer,
            ReportProperties properties
    ) {
        this.configStore = configStore;
        this.mailSenderFactory = mailSenderFactory;
        this.composer = composer;
        this.timeout = properties.getSmtpTimeout();
    }

    public void sendReport(ReportJob job, RenderedReport report) {
        SmtpSettings settings = SmtpSettings.from(configStore.current(), timeout);
        EmailEnvelope envelope = new EmailEnvelope(settings.from(), List.copyOf(job.getRecipients()),
                job.getSubject(), job.getBody());
        log.info("Sending report email job={} recipients={} subject={}",
                job.getId(), envelope.recipients(), envelope.subject());
        deliver(settings, envelope, message -> {
            if (report.format().isEmbedded()) {
                composer.composeEmbedded(message, envelope, report);
            } else {
                composer.composeAttachment(message, envelope, report);
            }
        });
    }

    public void sendText(List<String> recipients, String subject, String body) {
        SmtpSettings settings = SmtpSettings.from(configStore.current(), timeout);
        EmailEnvelope envelope = new EmailEnvelope(settings.from(), List.copyOf(recipients), subject, body);
        log.info("Sending test email recipients={}", envelope.recipients());
        deliver(settings, envelope, message -> composer.composeText(message, envelope));
    }

    private void deliver(SmtpSettings settings, EmailEnvelope envelope, MessageWriter writer) {
        JavaMailSender mailSender = mailSenderFactory.create(settings);
        try {
            MimeMessage message = mailSender.createMimeMessage();
            writer.write(message);
            mailSender.send(message);
        } catch (MessagingException | MailException ex) {
            throw new EmailDeliveryException("failed to send email via " + settings.host() + ":" + settings.port()
                    + ": " + ex.getMessage(), ex);
        }
        log.debug("Email delivered to {}", envelope.recipients());
    }

    @FunctionalInterface
    private interface MessageWriter {

        void write(MimeMessage message) throws MessagingException;
    }
}
