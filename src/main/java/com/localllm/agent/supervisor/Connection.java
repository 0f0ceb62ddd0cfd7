package com.localllm.agent.supervisor;

import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.tool.ToolDefinition;
import com.localllm.agent.transport.ToolTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime state of one provider connection. Owned by {@link ConnectionSupervisor};
 * field access is guarded by the instance monitor, connect attempts by
 * {@link #connectLock} so a slow handshake never blocks status reads.
 */
@Slf4j
final class Connection {

    private final long id;
    private final ProviderConfig config;
    final ReentrantLock connectLock = new ReentrantLock();

    private ToolTransport transport;
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private String lastError;
    private List<ToolDefinition> tools = List.of();
    private Instant lastActivity = Instant.now();
    private int attachments;
    private boolean retired;
    private int reconnectFailures;
    private Instant nextRetryAt = Instant.EPOCH;

    Connection(long id, ProviderConfig config) {
        this.id = id;
        this.config = config;
    }

    long id() {
        return id;
    }

    ProviderConfig config() {
        return config;
    }

    String providerId() {
        return config.getId();
    }

    synchronized ConnectionState state() {
        return state;
    }

    synchronized ToolTransport transport() {
        return transport;
    }

    synchronized List<ToolDefinition> tools() {
        return tools;
    }

    synchronized boolean isRetired() {
        return retired;
    }

    synchronized void retire() {
        retired = true;
    }

    synchronized int attach() {
        return ++attachments;
    }

    synchronized int detach() {
        if (attachments > 0) {
            attachments--;
        }
        return attachments;
    }

    synchronized int attachments() {
        return attachments;
    }

    synchronized void touch() {
        lastActivity = Instant.now();
    }

    synchronized Instant lastActivity() {
        return lastActivity;
    }

    synchronized String lastError() {
        return lastError;
    }

    synchronized Instant nextRetryAt() {
        return nextRetryAt;
    }

    synchronized boolean transition(ConnectionState next) {
        if (!state.canTransitionTo(next)) {
            return false;
        }
        log.debug("Connection state [provider={}, connection={}]: {} -> {}", providerId(), id, state, next);
        state = next;
        return true;
    }

    synchronized void markReady(ToolTransport transport, List<ToolDefinition> tools) {
        this.transport = transport;
        this.tools = List.copyOf(tools);
        this.lastError = null;
        this.reconnectFailures = 0;
        this.lastActivity = Instant.now();
        transition(ConnectionState.READY);
    }

    synchronized void refreshTools(List<ToolDefinition> tools) {
        this.tools = List.copyOf(tools);
        this.lastActivity = Instant.now();
    }

    /**
     * Records a failure and schedules the next reconnect with exponential backoff.
     * Returns the transport that must be closed by the caller (outside the monitor).
     */
    synchronized ToolTransport fail(ConnectionState next, String error, Duration baseDelay, Duration maxDelay) {
        lastError = error;
        reconnectFailures++;
        long factor = 1L << Math.min(reconnectFailures - 1, 20);
        Duration delay = baseDelay.multipliedBy(factor);
        if (delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }
        nextRetryAt = Instant.now().plus(delay);
        transition(next);
        ToolTransport broken = transport;
        transport = null;
        return broken;
    }

    /** Moves to CLOSED and hands back the transport to close. */
    synchronized ToolTransport closeState() {
        transition(ConnectionState.CLOSED);
        ToolTransport t = transport;
        transport = null;
        return t;
    }

    synchronized ConnectionStatus snapshot() {
        return new ConnectionStatus(providerId(), state, lastError, tools.size(), attachments, lastActivity);
    }
}
