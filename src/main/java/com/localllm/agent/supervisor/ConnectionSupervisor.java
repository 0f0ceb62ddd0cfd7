package com.localllm.agent.supervisor;

import com.localllm.agent.config.AgentProperties;
import com.localllm.agent.exception.ProviderUnavailableException;
import com.localllm.agent.exception.ToolInvocationException;
import com.localllm.agent.provider.ProviderChangedEvent;
import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.provider.ProviderRegistry;
import com.localllm.agent.tool.ToolDefinition;
import com.localllm.agent.transport.ToolResult;
import com.localllm.agent.transport.ToolTransport;
import com.localllm.agent.transport.TransportFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every provider connection: connect, health-check, reconnect, close.
 *
 * Design decisions:
 * - Connections live in an arena keyed by connection id; {@code active} maps a
 *   provider to its current connection. Callers only ever hold a {@link ConnectionLease}.
 * - A registry mutation retires the current connection instead of closing it.
 *   Conversations already attached keep using it; the next acquire builds a fresh one.
 * - A connection closes when its last lease is released, or at shutdown.
 * - {@link #invoke} never throws for provider trouble. Transport failures demote the
 *   connection and come back as an error {@link ToolResult} the LLM can read.
 */
@Service
@Slf4j
public class ConnectionSupervisor {

    private final ProviderRegistry registry;
    private final TransportFactory transportFactory;
    private final AgentProperties.Supervisor settings;

    private final Map<Long, Connection> arena = new ConcurrentHashMap<>();
    private final Map<String, Long> active = new ConcurrentHashMap<>();
    private final AtomicLong connectionIds = new AtomicLong();
    /** Connect failures per provider; outlives the closed connection so backoff keeps growing. */
    private final Map<String, ConnectBackoff> backoffs = new ConcurrentHashMap<>();
    private final Object topologyLock = new Object();

    public ConnectionSupervisor(ProviderRegistry registry,
                                TransportFactory transportFactory,
                                AgentProperties properties) {
        this.registry = registry;
        this.transportFactory = transportFactory;
        this.settings = properties.getSupervisor();
    }

    // ─── Leases ─────────────────────────────────────────────────────────────

    public ConnectionLease acquire(String providerId) {
        ProviderConfig config = registry.find(providerId)
                .orElseThrow(() -> new ProviderUnavailableException(providerId, "unknown provider"));
        if (!config.isEnabled()) {
            throw new ProviderUnavailableException(providerId, "provider is disabled");
        }

        Connection connection;
        synchronized (topologyLock) {
            connection = currentConnection(config);
            connection.attach();
        }
        try {
            ensureReadyOnDemand(connection);
        } catch (ProviderUnavailableException e) {
            detach(connection);
            throw e;
        }
        log.debug("Lease acquired [provider={}, connection={}, attachments={}]",
                providerId, connection.id(), connection.attachments());
        return new ConnectionLease(connection.id(), providerId);
    }

    public void release(ConnectionLease lease) {
        if (lease == null || !lease.markReleased()) {
            return;
        }
        Connection connection = arena.get(lease.connectionId());
        if (connection != null) {
            detach(connection);
        }
    }

    public List<ToolDefinition> capabilities(ConnectionLease lease) {
        Connection connection = arena.get(lease.connectionId());
        return connection != null ? connection.tools() : List.of();
    }

    public ToolResult invoke(ConnectionLease lease, String toolName, Map<String, Object> arguments) {
        if (lease.isReleased()) {
            return ToolResult.failure("Tool '" + toolName + "' is no longer available: connection released");
        }
        Connection connection;
        try {
            connection = usableConnection(lease);
        } catch (ProviderUnavailableException e) {
            log.warn("Tool call skipped [provider={}, tool={}]: {}", lease.providerId(), toolName, e.getMessage());
            return ToolResult.failure(e.getMessage());
        }

        ToolTransport transport = connection.transport();
        if (transport == null) {
            return ToolResult.failure("Provider '" + lease.providerId() + "' is not connected");
        }
        try {
            ToolResult result = transport.callTool(toolName, arguments);
            connection.touch();
            return result;
        } catch (ToolInvocationException e) {
            connection.touch();
            log.info("Tool returned an error [provider={}, tool={}, code={}]", lease.providerId(), toolName, e.getCode());
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            demote(connection, e);
            return ToolResult.failure("Tool '" + toolName + "' failed: provider '" + lease.providerId()
                    + "' connection error: " + e.getMessage());
        }
    }

    // ─── Registry coupling ──────────────────────────────────────────────────

    @EventListener
    public void onProviderChanged(ProviderChangedEvent event) {
        invalidate(event.providerId());
    }

    /** Retires the provider's current connection. Never closes a connection that is still attached. */
    public void invalidate(String providerId) {
        backoffs.remove(providerId);
        Connection retired;
        synchronized (topologyLock) {
            Long id = active.remove(providerId);
            retired = id != null ? arena.get(id) : null;
            if (retired == null) {
                return;
            }
            retired.retire();
        }
        log.info("Connection retired [provider={}, connection={}, attachments={}]",
                providerId, retired.id(), retired.attachments());
        if (retired.attachments() == 0) {
            closeConnection(retired);
        }
    }

    // ─── Status ─────────────────────────────────────────────────────────────

    public ConnectionStatus status(String providerId) {
        return currentFor(providerId).map(Connection::snapshot).orElseGet(() -> ConnectionStatus.idle(providerId));
    }

    public List<ConnectionStatus> statuses() {
        return registry.list().stream().map(p -> status(p.getId())).toList();
    }

    /** Tools of the provider's current connection, connecting briefly if none is open. */
    public List<ToolDefinition> describeTools(String providerId) {
        ConnectionLease lease = acquire(providerId);
        try {
            return capabilities(lease);
        } finally {
            release(lease);
        }
    }

    // ─── Health ─────────────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${agent.supervisor.probe-interval:PT30S}",
               initialDelayString = "${agent.supervisor.probe-interval:PT30S}")
    public void healthCheck() {
        try {
            runHealthCheck(Instant.now());
        } catch (RuntimeException e) {
            log.error("Health check pass failed: {}", e.getMessage(), e);
        }
    }

    void runHealthCheck(Instant now) {
        Duration interval = settings.getProbeInterval();
        for (Connection connection : List.copyOf(arena.values())) {
            ConnectionState state = connection.state();
            if (state == ConnectionState.READY
                    && !connection.lastActivity().plus(interval).isAfter(now)) {
                probe(connection);
            } else if ((state == ConnectionState.DEGRADED || state == ConnectionState.DISCONNECTED)
                    && connection.attachments() > 0
                    && !connection.nextRetryAt().isAfter(now)) {
                try {
                    ensureReady(connection);
                    log.info("Provider recovered [provider={}, connection={}]", connection.providerId(), connection.id());
                } catch (ProviderUnavailableException e) {
                    log.warn("Reconnect failed [provider={}], next attempt at {}",
                            connection.providerId(), connection.nextRetryAt());
                }
            }
        }
    }

    private void probe(Connection connection) {
        ToolTransport transport = connection.transport();
        if (transport == null) {
            return;
        }
        try {
            connection.refreshTools(transport.listTools());
            log.debug("Health probe ok [provider={}]", connection.providerId());
        } catch (RuntimeException e) {
            demote(connection, e);
        }
    }

    // ─── Shutdown ───────────────────────────────────────────────────────────

    @PreDestroy
    public void shutdown() {
        List<Connection> all;
        synchronized (topologyLock) {
            all = new ArrayList<>(arena.values());
            active.clear();
        }
        all.forEach(this::closeConnection);
        log.info("Connection supervisor shut down [closed={}]", all.size());
    }

    // ─── Internals ──────────────────────────────────────────────────────────

    private Connection currentConnection(ProviderConfig config) {
        Long id = active.get(config.getId());
        Connection existing = id != null ? arena.get(id) : null;
        if (existing != null && existing.state() != ConnectionState.CLOSED && !existing.isRetired()) {
            return existing;
        }
        Connection created = new Connection(connectionIds.incrementAndGet(), config);
        arena.put(created.id(), created);
        active.put(config.getId(), created.id());
        return created;
    }

    private Optional<Connection> currentFor(String providerId) {
        return Optional.ofNullable(active.get(providerId)).map(arena::get);
    }

    /**
     * Resolves a lease to a connection that is READY, reconnecting on demand.
     * A retired connection that is no longer READY is swapped for the
     * provider's current one, carrying the fresh config.
     */
    private Connection usableConnection(ConnectionLease lease) {
        Connection connection = arena.get(lease.connectionId());
        if (connection != null && connection.state() == ConnectionState.READY) {
            return connection;
        }
        if (connection == null || connection.isRetired() || connection.state() == ConnectionState.CLOSED) {
            return rebind(lease, connection);
        }
        ensureReadyOnDemand(connection);
        return connection;
    }

    private Connection rebind(ConnectionLease lease, Connection old) {
        ProviderConfig config = registry.find(lease.providerId())
                .orElseThrow(() -> new ProviderUnavailableException(lease.providerId(), "provider was removed"));
        if (!config.isEnabled()) {
            throw new ProviderUnavailableException(lease.providerId(), "provider is disabled");
        }
        Connection current;
        synchronized (topologyLock) {
            current = currentConnection(config);
            current.attach();
            lease.rebind(current.id());
        }
        if (old != null) {
            detach(old);
        }
        log.info("Lease moved to fresh connection [provider={}, from={}, to={}]",
                lease.providerId(), old != null ? old.id() : -1, current.id());
        ensureReadyOnDemand(current);
        return current;
    }

    /**
     * Connects a conversation-driven connection, unless the provider is still
     * inside its reconnect backoff. Scheduled reconnects bypass this check.
     */
    private void ensureReadyOnDemand(Connection connection) {
        if (connection.state() == ConnectionState.READY) {
            return;
        }
        ConnectBackoff backoff = backoffs.get(connection.providerId());
        Instant notBefore = connection.nextRetryAt();
        if (backoff != null && backoff.notBefore().isAfter(notBefore)) {
            notBefore = backoff.notBefore();
        }
        if (notBefore.isAfter(Instant.now())) {
            String lastError = connection.lastError() != null ? connection.lastError()
                    : backoff != null ? backoff.lastError() : "not connected";
            throw new ProviderUnavailableException(connection.providerId(),
                    lastError + " (next reconnect attempt at " + notBefore + ")");
        }
        try {
            ensureReady(connection);
        } catch (ProviderUnavailableException e) {
            String error = connection.lastError() != null ? connection.lastError() : e.getMessage();
            backoffs.compute(connection.providerId(), (id, previous) -> ConnectBackoff.after(previous, error,
                    settings.getReconnectBaseDelay(), settings.getReconnectMaxDelay()));
            throw e;
        }
    }

    private void ensureReady(Connection connection) {
        if (connection.state() == ConnectionState.READY) {
            return;
        }
        connection.connectLock.lock();
        try {
            if (connection.state() == ConnectionState.READY) {
                return;
            }
            int attempts = Math.max(1, settings.getConnectAttempts());
            RuntimeException lastFailure = null;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                if (!connection.transition(ConnectionState.CONNECTING)) {
                    throw new ProviderUnavailableException(connection.providerId(),
                            "connection is " + connection.state());
                }
                ToolTransport transport = transportFactory.create(connection.config());
                try {
                    transport.connect();
                    List<ToolDefinition> tools = transport.listTools();
                    connection.markReady(transport, tools);
                    backoffs.remove(connection.providerId());
                    log.info("Provider connected [provider={}, connection={}, tools={}]",
                            connection.providerId(), connection.id(), tools.size());
                    return;
                } catch (RuntimeException e) {
                    lastFailure = e;
                    transport.close();
                    connection.fail(ConnectionState.DISCONNECTED, e.getMessage(),
                            settings.getReconnectBaseDelay(), settings.getReconnectMaxDelay());
                    log.warn("Connect attempt {}/{} failed [provider={}]: {}",
                            attempt, attempts, connection.providerId(), e.getMessage());
                }
            }
            throw new ProviderUnavailableException(connection.providerId(),
                    lastFailure != null ? lastFailure.getMessage() : "connect failed", lastFailure);
        } finally {
            connection.connectLock.unlock();
        }
    }

    private void demote(Connection connection, RuntimeException cause) {
        if (connection.state() != ConnectionState.READY) {
            return;
        }
        ToolTransport broken = connection.fail(ConnectionState.DEGRADED, cause.getMessage(),
                settings.getReconnectBaseDelay(), settings.getReconnectMaxDelay());
        log.warn("Provider degraded [provider={}, connection={}]: {}",
                connection.providerId(), connection.id(), cause.getMessage());
        if (broken != null) {
            broken.close();
        }
    }

    private void detach(Connection connection) {
        boolean close;
        synchronized (topologyLock) {
            close = connection.detach() == 0;
            if (close) {
                arena.remove(connection.id());
                active.remove(connection.providerId(), connection.id());
            }
        }
        if (close) {
            closeConnection(connection);
        }
    }

    private void closeConnection(Connection connection) {
        synchronized (topologyLock) {
            arena.remove(connection.id());
            active.remove(connection.providerId(), connection.id());
        }
        ToolTransport transport = connection.closeState();
        if (transport != null) {
            transport.close();
        }
        log.debug("Connection closed [provider={}, connection={}]", connection.providerId(), connection.id());
    }
}
