package com.triprelay.failure;

import com.triprelay.domain.AttemptRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-message failure accounting
 * - Counts failed attempts per message id
 * - Declares a message poisoned once the retry budget is spent
 * - Permanent failures poison on first occurrence
 *
 * State lives in memory only and is lost on restart.
 */
@Slf4j
public class FailureTracker {

    private final int maxAttempts;
    private final ParseFailurePolicy parseFailurePolicy;
    private final Clock clock;
    private final Map<String, AttemptRecord> records = new HashMap<>();

    public FailureTracker(int maxAttempts, ParseFailurePolicy parseFailurePolicy, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.parseFailurePolicy = parseFailurePolicy;
        this.clock = clock;
    }

    /**
     * Record a transient failure and decide whether the message may be retried
     */
    public FailureDecision recordFailure(String messageId, String reason) {
        return recordFailure(messageId, null, reason);
    }

    /**
     * Record a transient failure of a given category.
     * Returns POISON once the attempt count reaches the maximum.
     */
    public synchronized FailureDecision recordFailure(String messageId, FailureCategory category, String reason) {
        AttemptRecord record = records.computeIfAbsent(messageId,
                id -> AttemptRecord.builder().messageId(id).count(0).build());

        boolean repeatedParseFailure = category == FailureCategory.PARSE
                && record.getLastCategory() == FailureCategory.PARSE;

        record.setCount(record.getCount() + 1);
        record.setLastAttemptAt(Instant.now(clock));
        record.setLastFailureReason(reason);
        record.setLastCategory(category);

        log.info("Message {} failure count: {}/{} ({})", messageId, record.getCount(), maxAttempts, reason);

        if (record.getCount() >= maxAttempts) {
            return FailureDecision.POISON;
        }
        if (repeatedParseFailure && parseFailurePolicy == ParseFailurePolicy.POISON_ON_REPEAT) {
            log.warn("Message {} produced unparseable output twice in a row", messageId);
            return FailureDecision.POISON;
        }
        return FailureDecision.RETRY;
    }

    /**
     * Record a permanent failure: poisons immediately, regardless of budget
     */
    public synchronized FailureDecision recordPermanent(String messageId, String reason) {
        AttemptRecord record = records.computeIfAbsent(messageId,
                id -> AttemptRecord.builder().messageId(id).count(0).build());
        record.setCount(record.getCount() + 1);
        record.setLastAttemptAt(Instant.now(clock));
        record.setLastFailureReason(reason);
        log.warn("Message {} failed permanently: {}", messageId, reason);
        return FailureDecision.POISON;
    }

    /**
     * A success resets any earlier failure history
     */
    public void recordSuccess(String messageId) {
        clear(messageId);
    }

    public synchronized void clear(String messageId) {
        if (records.remove(messageId) != null) {
            log.debug("Cleared failure history for message {}", messageId);
        }
    }

    /**
     * True if the next failure of this message must poison it
     */
    public synchronized boolean isExhausted(String messageId) {
        AttemptRecord record = records.get(messageId);
        return record != null && record.getCount() >= maxAttempts;
    }

    public synchronized int attempts(String messageId) {
        AttemptRecord record = records.get(messageId);
        return record == null ? 0 : record.getCount();
    }

    public synchronized Optional<AttemptRecord> find(String messageId) {
        AttemptRecord record = records.get(messageId);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(AttemptRecord.builder()
                .messageId(record.getMessageId())
                .count(record.getCount())
                .lastAttemptAt(record.getLastAttemptAt())
                .lastFailureReason(record.getLastFailureReason())
                .lastCategory(record.getLastCategory())
                .build());
    }

    public synchronized List<String> trackedIds() {
        return new ArrayList<>(records.keySet());
    }

    public synchronized int size() {
        return records.size();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
