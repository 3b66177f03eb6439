package com.triprelay.pipeline;

import com.triprelay.domain.InboundMessage;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reasoning request frame: message fields plus the required JSON answer shape
 */
@Component
public class PromptBuilder {

    static final int MAX_SECTION_CHARS = 20000;

    public String build(InboundMessage message) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("""
                Analyze the email below. Classify it and, if it describes travel, produce an
                iCalendar (RFC 5545) file of all its events and a short plain-text summary.

                Answer with a single JSON object and nothing else:
                {
                  "message_type": "TRAVEL_ITINERARY" | "AUTO_REPLY" | "BOUNCE" | "OTHER",
                  "message_type_reason": "<one sentence>",
                  "ics_content": "<complete VCALENDAR text, or empty>",
                  "email_summary": "<plain-text summary for the reply>"
                }

                """);
        prompt.append("Subject: ").append(nullToEmpty(message.getSubject())).append('\n');
        prompt.append("From: ").append(nullToEmpty(message.getSender())).append('\n');
        prompt.append("\nBody:\n").append(truncate(message.getBodyText())).append('\n');

        List<String> attachmentTexts = message.getAttachmentTexts();
        for (int i = 0; i < attachmentTexts.size(); i++) {
            String text = attachmentTexts.get(i);
            if (text == null || text.isBlank()) {
                continue;
            }
            String name = i < message.getAttachments().size() ? message.getAttachments().get(i).filename() : null;
            prompt.append("\nAttachment ").append(i + 1);
            if (name != null) {
                prompt.append(" (").append(name).append(')');
            }
            prompt.append(":\n").append(truncate(text)).append('\n');
        }
        return prompt.toString();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_SECTION_CHARS ? text : text.substring(0, MAX_SECTION_CHARS);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
