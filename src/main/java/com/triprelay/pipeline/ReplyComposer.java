package com.triprelay.pipeline;

import com.triprelay.config.DaemonProperties;
import com.triprelay.domain.InboundMessage;
import com.triprelay.domain.ReasoningResult;
import com.triprelay.mail.ReplyAttachment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reply texts: itinerary reply with or without calendar, and the failure notice
 */
@Component
@RequiredArgsConstructor
public class ReplyComposer {

    static final int MAX_SUBJECT_CHARS = 100;
    static final String ITINERARY_SUFFIX = " - Complete Travel Itinerary";
    static final String FAILURE_SUFFIX = " - Processing Error";

    private final DaemonProperties properties;

    public ReplyDraft itineraryReply(InboundMessage message, ReasoningResult result, boolean calendarValid) {
        String summary = result.summary() == null ? "" : result.summary().strip();
        String subject = replySubject(message.getSubject(), ITINERARY_SUFFIX);

        if (calendarValid) {
            String body = "Your travel itinerary has been processed successfully!\n\n"
                    + summary + "\n\n"
                    + "CALENDAR ATTACHMENT:\n"
                    + "The attached .ics file contains all your travel events. "
                    + "Open it to add the events to your calendar.\n\n"
                    + signature();
            return new ReplyDraft(subject, body,
                    ReplyAttachment.calendar(attachmentName(message.getId()), result.calendar()));
        }

        String body = "Your travel itinerary has been processed!\n\n"
                + summary + "\n\n"
                + "CALENDAR NOTE:\n"
                + "We were unable to generate a valid calendar attachment for this itinerary. "
                + "Please add the events to your calendar manually using the information above.\n\n"
                + signature();
        return new ReplyDraft(subject, body, null);
    }

    public ReplyDraft failureNotice(InboundMessage message) {
        String body = "We received your travel-related email but encountered an error while processing it.\n\n"
                + "Unfortunately, we were unable to extract the travel information "
                + "and generate a calendar attachment for this email.\n\n"
                + "WHAT YOU CAN DO:\n"
                + "- Forward the email again if you believe it was a temporary issue\n"
                + "- Manually add the travel events to your calendar using the original email\n\n"
                + "We apologize for the inconvenience.\n\n"
                + signature();
        return new ReplyDraft(replySubject(message.getSubject(), FAILURE_SUFFIX), body, null);
    }

    static String replySubject(String original, String suffix) {
        return "Re: " + cleanSubject(original) + suffix;
    }

    /**
     * Collapse line breaks and runs of whitespace, cut to the subject limit
     */
    static String cleanSubject(String subject) {
        if (subject == null) {
            return "";
        }
        String clean = subject.replaceAll("\\s+", " ").strip();
        return clean.length() <= MAX_SUBJECT_CHARS ? clean : clean.substring(0, MAX_SUBJECT_CHARS);
    }

    static String attachmentName(String messageId) {
        return "travel_itinerary_" + messageId.replaceAll("[^A-Za-z0-9_-]", "_") + ".ics";
    }

    private String signature() {
        return "Best regards,\n" + properties.getReply().getSignature() + "\n";
    }
}
