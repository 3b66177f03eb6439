package com.triprelay.domain;

/**
 * Mailbox connection status as seen by the monitor
 */
public enum ConnectionStatus {
    /** No usable connection - reconnect pending */
    DISCONNECTED,
    /** Connected in the selected mode */
    CONNECTED,
    /** Connected, but IDLE was given up after repeated processing errors */
    DEGRADED
}
