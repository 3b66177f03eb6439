package com.triprelay.mail;

import com.triprelay.domain.InboundMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;

/**
 * Protocol-level access to the watched mailbox.
 * Message ids are IMAP UIDs rendered as strings.
 */
public interface Mailbox {

    /**
     * Whether the server supports push notification (IMAP IDLE)
     */
    boolean probePushSupport() throws IOException;

    /**
     * Fetch full content without marking the message as seen
     *
     * @throws MalformedMessageException if the message cannot be decoded at all
     */
    InboundMessage fetch(String id) throws IOException;

    /**
     * Ids of all unseen messages, in ascending order
     */
    Set<String> searchUnseen() throws IOException;

    /**
     * Block until the server signals new mail, the timeout elapses, or
     * {@link #abortWait()} is called
     *
     * @return true if new messages were announced
     */
    boolean waitForNotification(Duration timeout) throws IOException;

    /**
     * Cut a running {@link #waitForNotification(Duration)} short; safe to call from another thread
     */
    default void abortWait() {
    }

    /**
     * Mark a message as handled; a second call for the same id is a no-op
     */
    void markHandled(String id) throws IOException;

    /**
     * Drop any current connection and open a fresh one
     */
    void reconnect() throws IOException;

    boolean isConnected();

    void close();
}
