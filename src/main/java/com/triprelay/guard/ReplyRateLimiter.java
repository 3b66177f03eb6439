package com.triprelay.guard;

import com.triprelay.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sliding-window limit on replies per recipient.
 * Safety net for loops the content classification misses.
 * Old entries are pruned lazily on access.
 */
@Slf4j
public class ReplyRateLimiter {

    private final int maxReplies;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> ledger = new HashMap<>();

    public ReplyRateLimiter(int maxReplies, Duration window, Clock clock) {
        if (maxReplies < 1) {
            throw new IllegalArgumentException("maxReplies must be >= 1: " + maxReplies);
        }
        this.maxReplies = maxReplies;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Read-only check; records nothing
     */
    public synchronized boolean canSend(String address) {
        return prune(AddressUtil.normalize(address)).size() < maxReplies;
    }

    /**
     * Atomic check-and-record: true and a new ledger entry if under the limit
     */
    public synchronized boolean tryAcquire(String address) {
        String key = AddressUtil.normalize(address);
        Deque<Instant> history = prune(key);
        if (history.size() >= maxReplies) {
            log.warn("Rate limit exceeded for {}: {} replies in {}s", key, history.size(), window.toSeconds());
            return false;
        }
        history.addLast(Instant.now(clock));
        ledger.put(key, history);
        return true;
    }

    /**
     * Give back the most recent slot, e.g. when the send itself failed
     */
    public synchronized void release(String address) {
        String key = AddressUtil.normalize(address);
        Deque<Instant> history = ledger.get(key);
        if (history != null && !history.isEmpty()) {
            history.removeLast();
            if (history.isEmpty()) {
                ledger.remove(key);
            }
        }
    }

    public synchronized int recentReplies(String address) {
        return prune(AddressUtil.normalize(address)).size();
    }

    /**
     * Recipients with at least one reply in the window
     */
    public synchronized int trackedRecipients() {
        return ledger.size();
    }

    /**
     * Normalized recipients currently at the limit, sorted
     */
    public synchronized List<String> limitedRecipients() {
        List<String> limited = new ArrayList<>();
        for (String key : new ArrayList<>(ledger.keySet())) {
            if (prune(key).size() >= maxReplies) {
                limited.add(key);
            }
        }
        limited.sort(null);
        return limited;
    }

    public synchronized void clear() {
        ledger.clear();
    }

    private Deque<Instant> prune(String key) {
        Deque<Instant> history = ledger.get(key);
        if (history == null) {
            return new ArrayDeque<>();
        }
        Instant cutoff = Instant.now(clock).minus(window);
        while (!history.isEmpty() && !history.peekFirst().isAfter(cutoff)) {
            history.removeFirst();
        }
        if (history.isEmpty()) {
            ledger.remove(key);
        }
        return history;
    }
}
