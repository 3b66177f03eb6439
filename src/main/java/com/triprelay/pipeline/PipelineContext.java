package com.triprelay.pipeline;

import com.triprelay.failure.FailureTracker;
import com.triprelay.guard.ReplyRateLimiter;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Daemon-wide mutable state handed to every pipeline run
 * - Failure history per message id
 * - Reply ledger per recipient
 * - Ids that reached a terminal outcome but could not be acknowledged yet
 *
 * Lifetime is the process lifetime; nothing here is persisted.
 */
@Getter
public class PipelineContext {

    private final FailureTracker failureTracker;
    private final ReplyRateLimiter rateLimiter;
    private final Set<String> pendingAcknowledgements = new LinkedHashSet<>();

    public PipelineContext(FailureTracker failureTracker, ReplyRateLimiter rateLimiter) {
        this.failureTracker = failureTracker;
        this.rateLimiter = rateLimiter;
    }

    public synchronized boolean isAcknowledgementPending(String messageId) {
        return pendingAcknowledgements.contains(messageId);
    }

    public synchronized void addPendingAcknowledgement(String messageId) {
        pendingAcknowledgements.add(messageId);
    }

    public synchronized void removePendingAcknowledgement(String messageId) {
        pendingAcknowledgements.remove(messageId);
    }

    public synchronized List<String> pendingAcknowledgementIds() {
        return List.copyOf(pendingAcknowledgements);
    }
}
