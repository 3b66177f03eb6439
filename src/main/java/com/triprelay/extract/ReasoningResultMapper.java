package com.triprelay.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.triprelay.domain.MessageType;
import com.triprelay.domain.ReasoningResult;
import org.springframework.stereotype.Component;

/**
 * Maps extracted JSON onto a {@link ReasoningResult}
 *
 * Expected shape:
 * <pre>
 * { "message_type": "TRAVEL_ITINERARY", "message_type_reason": "...",
 *   "ics_content": "BEGIN:VCALENDAR...", "email_summary": "..." }
 * </pre>
 */
@Component
public class ReasoningResultMapper {

    public ReasoningResult map(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new ExtractionException("Reasoning result is not a JSON object");
        }
        MessageType type = MessageType.fromValue(text(json, "message_type"));
        String reason = text(json, "message_type_reason");
        String calendar = text(json, "ics_content");
        String summary = text(json, "email_summary");

        if (!type.isAutomated() && (summary == null || summary.isBlank())) {
            throw new ExtractionException("Reasoning result has no email_summary");
        }
        return new ReasoningResult(type, reason, calendar, summary);
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }
}
