package com.triprelay.failure;

/**
 * A classified failure of one pipeline step
 */
public record ProcessingFailure(FailureKind kind, FailureCategory category, String reason) {

    public static ProcessingFailure transientFailure(FailureCategory category, String reason) {
        return new ProcessingFailure(FailureKind.TRANSIENT, category, reason);
    }

    public static ProcessingFailure permanentFailure(FailureCategory category, String reason) {
        return new ProcessingFailure(FailureKind.PERMANENT, category, reason);
    }

    public boolean isPermanent() {
        return kind == FailureKind.PERMANENT;
    }
}
