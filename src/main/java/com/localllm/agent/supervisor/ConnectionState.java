package com.localllm.agent.supervisor;

import java.util.EnumSet;
import java.util.Set;

public enum ConnectionState {

    DISCONNECTED,
    CONNECTING,
    READY,
    DEGRADED,
    /** Terminal. A closed connection is never reused. */
    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        if (next == CLOSED) {
            return this != CLOSED;
        }
        return allowedNext().contains(next);
    }

    private Set<ConnectionState> allowedNext() {
        return switch (this) {
            case DISCONNECTED, DEGRADED -> EnumSet.of(CONNECTING);
            case CONNECTING -> EnumSet.of(READY, DISCONNECTED);
            case READY -> EnumSet.of(DEGRADED);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }
}
