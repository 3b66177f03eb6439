package com.triprelay.monitor;

/**
 * Reconnect attempts are exhausted; the daemon cannot continue
 */
public class MailboxUnavailableException extends Exception {

    public MailboxUnavailableException(String message) {
        super(message);
    }
}
