package com.triprelay.domain;

/**
 * Structured reasoning-service result
 *
 * @param messageType    classification of the inbound mail
 * @param typeReason     free-form reason for the classification
 * @param calendar       generated iCalendar text, may be null
 * @param summary        reply body text
 */
public record ReasoningResult(MessageType messageType, String typeReason, String calendar, String summary) {

    public boolean hasCalendar() {
        return calendar != null && !calendar.isBlank();
    }
}
