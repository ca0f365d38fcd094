package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.enums.ReportFormat;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Part;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Builds report messages.
 * <ul>
 *     <li>attachment mode ({@code png}, {@code pdf}): {@code multipart/mixed} with the text body
 *     and the rendered file as a base64 attachment;</li>
 *     <li>embedded mode ({@code html}): {@code multipart/alternative} with a plain-text fallback
 *     and a {@code multipart/related} holding the HTML document and the inline PNG it
 *     references by Content-ID.</li>
 * </ul>
 * Base64 bodies are written in 76-character lines by Jakarta Mail's encoder.
 */
@Component
public class ReportEmailComposer {

    private static final String UTF_8 = StandardCharsets.UTF_8.name();
    private static final String BASE64 = "base64";
    private static final DateTimeFormatter FILENAME_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HHmmss");
    private static final DateTimeFormatter DISPLAY_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    static final String HTML_FALLBACK_TEXT =
            "This report contains an embedded dashboard snapshot. "
                    + "Please open this email in an HTML-capable email client to view it.";

    private final Clock clock;

    public ReportEmailComposer(Clock clock) {
        this.clock = clock;
    }

    public void composeAttachment(MimeMessage message, EmailEnvelope envelope, RenderedReport report)
            throws MessagingException {
        Instant now = clock.instant();
        ReportFormat format = report.format();
        MimeMessageHelper helper = new MimeMessageHelper(message, MimeMessageHelper.MULTIPART_MODE_MIXED, UTF_8);
        helper.setFrom(new InternetAddress(envelope.from()));
        helper.setTo(toAddresses(envelope.recipients()));
        helper.setSubject(nullToEmpty(envelope.subject()));
        helper.setSentDate(Date.from(now));
        helper.setText(nullToEmpty(envelope.body()), false);

        if (report.content() != null && report.content().length > 0) {
            helper.addAttachment(attachmentFileName(now, format),
                    new ByteArrayDataSource(report.content(), format.getContentType()));
            MimeMultipart mixed = helper.getRootMimeMultipart();
            mixed.getBodyPart(mixed.getCount() - 1).setHeader("Content-Transfer-Encoding", BASE64);
        }
        message.saveChanges();
    }

    public void composeEmbedded(MimeMessage message, EmailEnvelope envelope, RenderedReport report)
            throws MessagingException {
        Instant now = clock.instant();
        String contentId = "report-" + UUID.randomUUID() + "@grafana-reporter";

        MimeBodyPart plain = new MimeBodyPart();
        plain.setText(buildFallbackText(envelope.body()), UTF_8);

        MimeBodyPart html = new MimeBodyPart();
        html.setText(buildHtml(envelope, contentId, now), UTF_8, "html");

        MimeBodyPart image = new MimeBodyPart();
        image.setDataHandler(new DataHandler(new ByteArrayDataSource(report.content(), ReportFormat.HTML.getContentType())));
        image.setContentID("<" + contentId + ">");
        image.setDisposition(Part.INLINE);
        image.setFileName("report.png");
        image.setHeader("Content-Transfer-Encoding", BASE64);

        MimeMultipart related = new MimeMultipart("related");
        related.addBodyPart(html);
        related.addBodyPart(image);
        MimeBodyPart relatedPart = new MimeBodyPart();
        relatedPart.setContent(related);

        MimeMultipart alternative = new MimeMultipart("alternative");
        alternative.addBodyPart(plain);
        alternative.addBodyPart(relatedPart);

        applyHeaders(message, envelope, now);
        message.setContent(alternative);
        message.saveChanges();
    }

    public void composeText(MimeMessage message, EmailEnvelope envelope) throws MessagingException {
        applyHeaders(message, envelope, clock.instant());
        message.setText(nullToEmpty(envelope.body()), UTF_8);
        message.saveChanges();
    }

    String attachmentFileName(Instant time, ReportFormat format) {
        return "report-" + FILENAME_TIME_FORMATTER.withZone(clock.getZone()).format(time) + "." + format.getValue();
    }

    private void applyHeaders(MimeMessage message, EmailEnvelope envelope, Instant now) throws MessagingException {
        message.setFrom(new InternetAddress(envelope.from()));
        message.setRecipients(Message.RecipientType.TO, toAddresses(envelope.recipients()));
        message.setSubject(nullToEmpty(envelope.subject()), UTF_8);
        message.setSentDate(Date.from(now));
    }

    private static InternetAddress[] toAddresses(List<String> recipients) throws MessagingException {
        InternetAddress[] addresses = new InternetAddress[recipients.size()];
        for (int i = 0; i < recipients.size(); i++) {
            addresses[i] = new InternetAddress(recipients.get(i), true);
        }
        return addresses;
    }

    private static String buildFallbackText(String body) {
        String trimmed = nullToEmpty(body).trim();
        if (trimmed.isEmpty()) {
            return HTML_FALLBACK_TEXT + "\n";
        }
        return trimmed + "\n\n" + HTML_FALLBACK_TEXT + "\n";
    }

    private String buildHtml(EmailEnvelope envelope, String contentId, Instant now) {
        StringBuilder builder = new StringBuilder();
        builder.append("<!DOCTYPE html>")
                .append("<html><head><meta charset=\"utf-8\">")
                .append("<title>").append(escapeHtml(nullToEmpty(envelope.subject()))).append("</title>")
                .append("</head>")
                .append("<body style=\"font-family:Arial,Helvetica,sans-serif;margin:20px;color:#212121;\">");
        String subject = nullToEmpty(envelope.subject()).trim();
        if (!subject.isEmpty()) {
            builder.append("<h2 style=\"margin:0 0 16px 0;\">").append(escapeHtml(subject)).append("</h2>");
        }
        String body = nullToEmpty(envelope.body()).trim();
        if (!body.isEmpty()) {
            builder.append("<p style=\"margin:0 0 20px 0;\">")
                    .append(escapeHtml(body).replace("\r\n", "\n").replace("\n", "<br>"))
                    .append("</p>");
        }
        builder.append("<div>")
                .append("<img src=\"cid:").append(contentId)
                .append("\" alt=\"Dashboard snapshot\"")
                .append(" style=\"display:block;max-width:100%;height:auto;border:1px solid #ddd;\"/>")
                .append("</div>");
        builder.append("<p style=\"margin-top:16px;font-size:12px;color:#757575;\">Generated at ")
                .append(escapeHtml(DISPLAY_TIME_FORMATTER.withZone(clock.getZone()).format(now)))
                .append("</p>");
        builder.append("</body></html>");
        return builder.toString();
    }

    private static String escapeHtml(String value) {
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
