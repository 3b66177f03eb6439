package com.triprelay.domain;

/**
 * Mailbox monitor state machine
 */
public enum MonitorMode {
    /** (Re)connecting and selecting a notification mode */
    CONNECTING,
    /** Waiting on IMAP IDLE notifications */
    EVENT_MODE,
    /** Searching for unseen mail on a fixed interval */
    POLL_MODE,
    /** Terminal */
    SHUTTING_DOWN
}
