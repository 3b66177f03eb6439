package com.triprelay.domain;

/**
 * Message classification returned by the reasoning service
 */
public enum MessageType {
    TRAVEL_ITINERARY,
    AUTO_REPLY,
    BOUNCE,
    OTHER;

    /**
     * Lenient parse; unknown or missing values count as an itinerary
     */
    public static MessageType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TRAVEL_ITINERARY;
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    public boolean isAutomated() {
        return this == AUTO_REPLY || this == BOUNCE;
    }
}
