package com.triprelay.monitor;

import java.util.Set;

/**
 * Receives the unseen-message ids found by one monitor cycle
 */
@FunctionalInterface
public interface NewMessageHandler {

    /**
     * Process a batch of message ids, possibly empty.
     * Runs on the monitor thread; the next wait starts only after it returns.
     */
    BatchResult onNewMessages(Set<String> messageIds);
}
