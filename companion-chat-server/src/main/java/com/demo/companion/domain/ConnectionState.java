package com.demo.companion.domain;

/**
 * Lifecycle of a realtime connection. CLOSED is terminal.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        return switch (this) {
            case CONNECTING -> next == AUTHENTICATED || next == CLOSED;
            case AUTHENTICATED -> next == ACTIVE || next == CLOSED;
            case ACTIVE -> next == CLOSED;
            case CLOSED -> false;
        };
    }
}
