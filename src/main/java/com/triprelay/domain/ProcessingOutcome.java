package com.triprelay.domain;

/**
 * Terminal or retryable result of one pipeline run for one message
 */
public record ProcessingOutcome(Type type, boolean replySent, String reason) {

    public enum Type {
        SUCCESS,
        TRANSIENT_FAILURE,
        PERMANENT_FAILURE,
        SKIPPED
    }

    public static ProcessingOutcome success(boolean replySent) {
        return new ProcessingOutcome(Type.SUCCESS, replySent, null);
    }

    public static ProcessingOutcome transientFailure(String reason) {
        return new ProcessingOutcome(Type.TRANSIENT_FAILURE, false, reason);
    }

    public static ProcessingOutcome permanentFailure(String reason, boolean fallbackSent) {
        return new ProcessingOutcome(Type.PERMANENT_FAILURE, fallbackSent, reason);
    }

    public static ProcessingOutcome skipped(String reason) {
        return new ProcessingOutcome(Type.SKIPPED, false, reason);
    }
}
