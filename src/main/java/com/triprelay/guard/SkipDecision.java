package com.triprelay.guard;

/**
 * Result of auto-reply classification
 */
public record SkipDecision(boolean skip, String reason) {

    private static final SkipDecision REPLY = new SkipDecision(false, null);

    public static SkipDecision reply() {
        return REPLY;
    }

    public static SkipDecision skip(String reason) {
        return new SkipDecision(true, reason);
    }
}
