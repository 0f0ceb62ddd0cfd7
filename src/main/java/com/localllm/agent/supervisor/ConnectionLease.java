package com.localllm.agent.supervisor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Opaque handle a conversation holds on a provider connection.
 * Only the supervisor reads or moves the connection id.
 */
public final class ConnectionLease {

    private final String providerId;
    private volatile long connectionId;
    private final AtomicBoolean released = new AtomicBoolean();

    ConnectionLease(long connectionId, String providerId) {
        this.connectionId = connectionId;
        this.providerId = providerId;
    }

    public String providerId() {
        return providerId;
    }

    public boolean isReleased() {
        return released.get();
    }

    long connectionId() {
        return connectionId;
    }

    void rebind(long newConnectionId) {
        this.connectionId = newConnectionId;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "ConnectionLease[provider=" + providerId + ", connection=" + connectionId + "]";
    }
}
