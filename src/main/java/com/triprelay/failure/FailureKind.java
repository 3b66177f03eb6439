package com.triprelay.failure;

/**
 * Retryability of a processing error
 */
public enum FailureKind {
    /** Network timeout, remote 5xx, connection reset, unparseable but plausibly recoverable output */
    TRANSIENT,
    /** Locally detected unsupported input - retrying cannot help */
    PERMANENT
}
