package com.example.marketdata.model;

/**
 * Lifecycle of a trade streaming session.
 *
 * DISCONNECTED -> CONNECTING -> AUTHENTICATING -> SUBSCRIBING -> STREAMING -> CLOSED,
 * with FAILED reachable from any non-terminal state.
 */
public enum StreamState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    SUBSCRIBING,
    STREAMING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
