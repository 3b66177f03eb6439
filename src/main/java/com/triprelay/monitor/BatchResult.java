package com.triprelay.monitor;

/**
 * Tally of one handled batch
 */
public record BatchResult(int attempted, int succeeded, int skipped, int transientFailures, int permanentFailures) {

    private static final BatchResult EMPTY = new BatchResult(0, 0, 0, 0, 0);

    public static BatchResult empty() {
        return EMPTY;
    }

    /**
     * A non-empty batch where nothing got further than a transient failure
     */
    public boolean isFailure() {
        return attempted > 0 && transientFailures == attempted;
    }
}
