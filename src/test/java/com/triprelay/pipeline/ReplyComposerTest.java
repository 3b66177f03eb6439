package com.triprelay.pipeline;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.InboundMessage;
import com.triprelay.domain.MessageType;
import com.triprelay.domain.ReasoningResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReplyComposer unit tests
 */
class ReplyComposerTest {

    private final ReplyComposer composer = new ReplyComposer(new DaemonProperties());

    private static InboundMessage message(String subject) {
        return InboundMessage.builder().id("42").sender("alice@example.com").subject(subject).build();
    }

    @Test
    @DisplayName("Valid calendar: attachment travel_itinerary_<id>.ics and summary in body")
    void testItineraryReply_WithCalendar() {
        ReasoningResult result = new ReasoningResult(MessageType.TRAVEL_ITINERARY, null,
                "BEGIN:VCALENDAR", "Flight AA100 on March 10");

        ReplyDraft reply = composer.itineraryReply(message("Flight booking"), result, true);

        assertThat(reply.subject()).isEqualTo("Re: Flight booking - Complete Travel Itinerary");
        assertThat(reply.body()).contains("Flight AA100 on March 10").contains("TripRelay Itinerary Processing");
        assertThat(reply.hasAttachment()).isTrue();
        assertThat(reply.attachment().filename()).isEqualTo("travel_itinerary_42.ics");
        assertThat(reply.attachment().content()).isEqualTo("BEGIN:VCALENDAR");
        assertThat(reply.attachment().contentType()).startsWith("text/calendar");
    }

    @Test
    @DisplayName("Invalid calendar: no attachment and a calendar note")
    void testItineraryReply_WithoutCalendar() {
        ReasoningResult result = new ReasoningResult(MessageType.TRAVEL_ITINERARY, null, "garbage", "Hotel stay");

        ReplyDraft reply = composer.itineraryReply(message("Hotel"), result, false);

        assertThat(reply.hasAttachment()).isFalse();
        assertThat(reply.body()).contains("Hotel stay").contains("CALENDAR NOTE");
    }

    @Test
    @DisplayName("Failure notice subject")
    void testFailureNotice() {
        ReplyDraft notice = composer.failureNotice(message("Trip\r\n to   Rome"));

        assertThat(notice.subject()).isEqualTo("Re: Trip to Rome - Processing Error");
        assertThat(notice.hasAttachment()).isFalse();
        assertThat(notice.body()).contains("encountered an error");
    }

    @Test
    @DisplayName("Subjects are collapsed and cut at 100 characters")
    void testCleanSubject() {
        assertThat(ReplyComposer.cleanSubject("  a\n\tb  c ")).isEqualTo("a b c");
        assertThat(ReplyComposer.cleanSubject("x".repeat(150))).hasSize(100);
        assertThat(ReplyComposer.cleanSubject(null)).isEmpty();
    }

    @Test
    @DisplayName("Attachment name only keeps safe characters")
    void testAttachmentName() {
        assertThat(ReplyComposer.attachmentName("1234")).isEqualTo("travel_itinerary_1234.ics");
        assertThat(ReplyComposer.attachmentName("../x")).isEqualTo("travel_itinerary____x.ics");
    }
}
