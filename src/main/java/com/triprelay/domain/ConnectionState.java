package com.triprelay.domain;

import lombok.Data;

/**
 * Connection state of one mailbox monitor.
 * Transitions here are the only place network failures are absorbed.
 */
@Data
public class ConnectionState {

    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private int reconnectAttempts = 0;
    private String lastError;

    public void markConnected() {
        this.status = ConnectionStatus.CONNECTED;
        this.reconnectAttempts = 0;
    }

    public void markDisconnected(String error) {
        this.status = ConnectionStatus.DISCONNECTED;
        this.lastError = error;
    }

    public void markDegraded(String reason) {
        this.status = ConnectionStatus.DEGRADED;
        this.lastError = reason;
    }

    public int nextReconnectAttempt() {
        return ++reconnectAttempts;
    }
}
