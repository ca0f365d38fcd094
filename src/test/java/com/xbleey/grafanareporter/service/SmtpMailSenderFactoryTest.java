package com.xbleey.grafanareporter.service;

import org.junit.jupiter.api.Test;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SmtpMailSenderFactoryTest {

    private final SmtpMailSenderFactory factory = new SmtpMailSenderFactory();

    @Test
    void authenticatedSubmissionUsesPlainAuthAndStartTls() {
        JavaMailSenderImpl sender = (JavaMailSenderImpl) factory.create(new SmtpSettings(
                "smtp.example.com", 587, "robot", "pw", "robot@example.com", Duration.ofSeconds(30)));

        assertThat(sender.getHost()).isEqualTo("smtp.example.com");
        assertThat(sender.getPort()).isEqualTo(587);
        assertThat(sender.getUsername()).isEqualTo("robot");
        assertThat(sender.getJavaMailProperties())
                .containsEntry("mail.smtp.auth", "true")
                .containsEntry("mail.smtp.auth.mechanisms", "PLAIN")
                .containsEntry("mail.smtp.starttls.enable", "true")
                .containsEntry("mail.smtp.timeout", "30000");
    }

    @Test
    void anonymousRelaySkipsAuth() {
        JavaMailSenderImpl sender = (JavaMailSenderImpl) factory.create(new SmtpSettings(
                "relay.local", 25, null, null, "reports@local", Duration.ofSeconds(5)));

        assertThat(sender.getUsername()).isNull();
        assertThat(sender.getJavaMailProperties()).containsEntry("mail.smtp.auth", "false");
    }

    @Test
    void implicitTlsPortEnablesSsl() {
        JavaMailSenderImpl sender = (JavaMailSenderImpl) factory.create(new SmtpSettings(
                "smtp.example.com", 465, "robot", "pw", "robot@example.com", Duration.ofSeconds(30)));

        assertThat(sender.getJavaMailProperties())
                .containsEntry("mail.smtp.ssl.enable", "true")
                .doesNotContainKey("mail.smtp.starttls.enable");
    }
}
