package com.triprelay.mail;

import com.triprelay.config.DaemonProperties;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;

/**
 * SMTP reply transmission via Jakarta Mail
 * - STARTTLS + AUTH when credentials are configured
 * - Independent connect/read/write timeouts
 * - Replies carry RFC 3834 headers so remote auto-responders stay quiet
 */
@Slf4j
@Component
public class SmtpMailer implements Mailer {

    private final DaemonProperties.Smtp settings;
    private final Session session;

    @Autowired
    public SmtpMailer(DaemonProperties properties) {
        this(properties.getSmtp(), Session.getInstance(sessionProperties(properties.getSmtp())));
    }

    SmtpMailer(DaemonProperties.Smtp settings, Session session) {
        this.settings = settings;
        this.session = session;
    }

    static Properties sessionProperties(DaemonProperties.Smtp smtp) {
        Properties props = new Properties();
        props.put("mail.smtp.host", smtp.getHost());
        props.put("mail.smtp.port", String.valueOf(smtp.getPort()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(smtp.getConnectionTimeoutMs()));
        props.put("mail.smtp.timeout", String.valueOf(smtp.getTimeoutMs()));
        props.put("mail.smtp.writetimeout", String.valueOf(smtp.getWriteTimeoutMs()));
        props.put("mail.smtp.starttls.enable", String.valueOf(smtp.isStartTls()));
        props.put("mail.smtp.starttls.required", String.valueOf(smtp.isStartTls()));
        props.put("mail.smtp.auth", String.valueOf(smtp.getUsername() != null && !smtp.getUsername().isBlank()));
        return props;
    }

    @Override
    public void send(String to, String subject, String body, ReplyAttachment attachment) throws MailerException {
        try {
            MimeMessage message = buildMessage(to, subject, body, attachment);
            Transport transport = session.getTransport("smtp");
            try {
                transport.connect(settings.getHost(), settings.getPort(), settings.getUsername(), settings.getPassword());
                transport.sendMessage(message, message.getAllRecipients());
                log.info("Reply sent to {} via {}:{}", to, settings.getHost(), settings.getPort());
            } finally {
                transport.close();
            }
        } catch (MessagingException e) {
            throw new MailerException("Send to " + to + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Build the reply; a calendar attachment turns it into multipart/mixed
     */
    MimeMessage buildMessage(String to, String subject, String body, ReplyAttachment attachment)
            throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(settings.getFromAddress()));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(to, false));
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());
        message.setHeader("Auto-Submitted", "auto-replied");
        message.setHeader("X-Auto-Response-Suppress", "All");

        if (attachment == null) {
            message.setText(body, StandardCharsets.UTF_8.name());
        } else {
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(body, StandardCharsets.UTF_8.name());

            MimeBodyPart filePart = new MimeBodyPart();
            filePart.setDataHandler(new DataHandler(new ByteArrayDataSource(
                    attachment.content().getBytes(StandardCharsets.UTF_8), attachment.contentType())));
            filePart.setFileName(attachment.filename());
            filePart.setDisposition(MimeBodyPart.ATTACHMENT);

            MimeMultipart multipart = new MimeMultipart("mixed");
            multipart.addBodyPart(textPart);
            multipart.addBodyPart(filePart);
            message.setContent(multipart);
        }
        message.saveChanges();
        return message;
    }
}
