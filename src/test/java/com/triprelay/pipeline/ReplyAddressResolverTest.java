package com.triprelay.pipeline;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.InboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReplyAddressResolver unit tests
 * - Ordinary senders
 * - Do-not-reply senders with and without forwarder / default
 */
class ReplyAddressResolverTest {

    private DaemonProperties properties;
    private ReplyAddressResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new DaemonProperties();
        resolver = new ReplyAddressResolver(properties);
    }

    private static InboundMessage message(String sender, String subject, String body) {
        return InboundMessage.builder().id("1").sender(sender).subject(subject).bodyText(body).build();
    }

    @Test
    @DisplayName("Ordinary sender receives the reply")
    void testResolve_OrdinarySender() {
        assertThat(resolver.resolve(message("Alice <Alice@example.com>", "Trip", "")))
                .contains("Alice@example.com");
    }

    @Test
    @DisplayName("No-reply sender without default gets no reply")
    void testResolve_NoReplyWithoutDefault() {
        assertThat(resolver.resolve(message("Booking <no-reply@booking.example>", "Your booking", "")))
                .isEmpty();
    }

    @Test
    @DisplayName("No-reply sender falls back to the configured default")
    void testResolve_NoReplyWithDefault() {
        properties.getReply().setDefaultReplyTo(" traveller@example.com ");

        assertThat(resolver.resolve(message("noreply@booking.example", "Your booking", "")))
                .contains("traveller@example.com");
    }

    @Test
    @DisplayName("Airline domains and their subdomains count as system senders")
    void testIsDoNotReply_SystemDomains() {
        assertThat(resolver.isDoNotReply("receipts@delta.com")).isTrue();
        assertThat(resolver.isDoNotReply("itinerary@email.united.com")).isTrue();
        assertThat(resolver.isDoNotReply("someone@notdelta.com")).isFalse();
        assertThat(resolver.isDoNotReply("alice@example.com")).isFalse();
    }

    @Test
    @DisplayName("Forwarded system mail is answered to the forwarder found in the body")
    void testResolve_ForwardedMail() {
        String body = "---------- Forwarded message ---------\n"
                + "From: Bob Traveller <bob@example.org>\n"
                + "Date: Mon, 3 Mar 2025\n"
                + "Subject: Your trip";

        assertThat(resolver.resolve(message("notifications@delta.com", "Fwd: Your trip confirmation", body)))
                .contains("bob@example.org");
    }

    @Test
    @DisplayName("Forwarder line beyond the first ten lines is ignored")
    void testResolve_ForwarderTooDeep() {
        String body = "\n".repeat(12) + "From: bob@example.org";
        properties.getReply().setDefaultReplyTo("fallback@example.com");

        assertThat(resolver.resolve(message("noreply@united.com", "FW: Trip", body)))
                .contains("fallback@example.com");
    }

    @Test
    @DisplayName("Missing sender uses the default reply-to")
    void testResolve_MissingSender() {
        assertThat(resolver.resolve(message(null, "Trip", "body"))).isEmpty();

        properties.getReply().setDefaultReplyTo("traveller@example.com");
        assertThat(resolver.resolve(message("", "Trip", "body"))).contains("traveller@example.com");
    }
}
