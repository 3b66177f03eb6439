package com.triprelay.mail;

import com.triprelay.config.DaemonProperties;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SmtpMailer unit tests (message construction, no network)
 */
class SmtpMailerTest {

    private DaemonProperties.Smtp settings;
    private SmtpMailer mailer;

    @BeforeEach
    void setUp() {
        settings = new DaemonProperties.Smtp();
        settings.setHost("smtp.example.com");
        settings.setUsername("trips@example.com");
        settings.setFromAddress("trips@example.com");
        mailer = new SmtpMailer(settings, Session.getInstance(new Properties()));
    }

    @Test
    @DisplayName("Reply carries From/To, subject and RFC 3834 headers")
    void testBuildMessage_Headers() throws Exception {
        MimeMessage message = mailer.buildMessage("alice@example.com", "Re: Trip - Processing Error", "body", null);

        assertThat(message.getFrom()[0].toString()).isEqualTo("trips@example.com");
        assertThat(message.getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("alice@example.com");
        assertThat(message.getSubject()).isEqualTo("Re: Trip - Processing Error");
        assertThat(message.getHeader("Auto-Submitted", null)).isEqualTo("auto-replied");
        assertThat(message.getHeader("X-Auto-Response-Suppress", null)).isEqualTo("All");
        assertThat(message.getContent()).isEqualTo("body");
    }

    @Test
    @DisplayName("Calendar attachment makes a multipart/mixed message")
    void testBuildMessage_CalendarAttachment() throws Exception {
        ReplyAttachment attachment = ReplyAttachment.calendar("travel_itinerary_42.ics", "BEGIN:VCALENDAR\r\nEND:VCALENDAR\r\n");

        MimeMessage message = mailer.buildMessage("alice@example.com", "Re: Trip", "Your trip", attachment);

        assertThat(message.getContent()).isInstanceOf(MimeMultipart.class);
        MimeMultipart multipart = (MimeMultipart) message.getContent();
        assertThat(multipart.getCount()).isEqualTo(2);
        assertThat(multipart.getBodyPart(0).getContent()).isEqualTo("Your trip");

        MimeBodyPart calendarPart = (MimeBodyPart) multipart.getBodyPart(1);
        assertThat(calendarPart.getFileName()).isEqualTo("travel_itinerary_42.ics");
        assertThat(calendarPart.isMimeType("text/calendar")).isTrue();
        assertThat(new String(calendarPart.getInputStream().readAllBytes(), StandardCharsets.UTF_8))
                .startsWith("BEGIN:VCALENDAR");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        message.writeTo(out);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("method=PUBLISH");
    }

    @Test
    @DisplayName("Session properties carry timeouts, STARTTLS and AUTH")
    void testSessionProperties() {
        settings.setConnectionTimeoutMs(1111L);
        settings.setTimeoutMs(2222L);
        settings.setWriteTimeoutMs(3333L);

        Properties props = SmtpMailer.sessionProperties(settings);

        assertThat(props.getProperty("mail.smtp.connectiontimeout")).isEqualTo("1111");
        assertThat(props.getProperty("mail.smtp.timeout")).isEqualTo("2222");
        assertThat(props.getProperty("mail.smtp.writetimeout")).isEqualTo("3333");
        assertThat(props.getProperty("mail.smtp.starttls.enable")).isEqualTo("true");
        assertThat(props.getProperty("mail.smtp.auth")).isEqualTo("true");
    }
}
