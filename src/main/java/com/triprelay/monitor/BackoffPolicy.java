package com.triprelay.monitor;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Exponential backoff with additive jitter: {@code min(base * 2^attempt + jitter, max)}
 */
public class BackoffPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final long jitterMs;
    private final LongUnaryOperator jitterSource;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs, long jitterMs) {
        this(baseDelayMs, maxDelayMs, jitterMs, bound -> ThreadLocalRandom.current().nextLong(bound));
    }

    /**
     * @param jitterSource returns a value in [0, bound) for a positive bound
     */
    BackoffPolicy(long baseDelayMs, long maxDelayMs, long jitterMs, LongUnaryOperator jitterSource) {
        if (baseDelayMs < 0 || maxDelayMs < 0 || jitterMs < 0) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterMs = jitterMs;
        this.jitterSource = jitterSource;
    }

    /**
     * Delay before a retry; attempt 0 is the first retry
     */
    public long delayMs(int attempt) {
        double exponential = baseDelayMs * Math.pow(2, Math.max(0, attempt));
        if (exponential >= maxDelayMs) {
            return maxDelayMs;
        }
        long jitter = jitterMs > 0 ? jitterSource.applyAsLong(jitterMs) : 0L;
        return Math.min((long) exponential + jitter, maxDelayMs);
    }
}
