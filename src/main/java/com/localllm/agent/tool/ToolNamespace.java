package com.localllm.agent.tool;

import com.localllm.agent.supervisor.ConnectionLease;
import com.localllm.agent.supervisor.ConnectionSupervisor;
import com.localllm.agent.transport.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Merged tool set of one conversation. Holds a lease per contributing
 * provider; closing the namespace releases them.
 */
@Slf4j
public class ToolNamespace implements AutoCloseable {

    /** One resolved tool: where it lives and how to describe it to the LLM. */
    public record Entry(String providerId, ToolDefinition definition, ConnectionLease lease) {
    }

    private final List<String> selection;
    private final Map<String, Entry> entries;
    private final List<ConnectionLease> leases;
    private final ConnectionSupervisor supervisor;
    private final AtomicBoolean closed = new AtomicBoolean();

    ToolNamespace(List<String> selection, Map<String, Entry> entries,
                  List<ConnectionLease> leases, ConnectionSupervisor supervisor) {
        this.selection = List.copyOf(selection);
        this.entries = new LinkedHashMap<>(entries);
        this.leases = List.copyOf(leases);
        this.supervisor = supervisor;
    }

    public List<String> selection() {
        return selection;
    }

    public Optional<Entry> resolve(String toolName) {
        return Optional.ofNullable(entries.get(toolName));
    }

    public Collection<String> toolNames() {
        return entries.keySet();
    }

    public List<ToolDefinition> definitions() {
        return entries.values().stream().map(Entry::definition).toList();
    }

    /** Provider ids that actually contributed a lease, in selection order. */
    public List<String> connectedProviders() {
        return leases.stream().map(ConnectionLease::providerId).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public ToolResult invokeByQualifiedName(String toolName, Map<String, Object> arguments) {
        if (closed.get()) {
            return ToolResult.failure("Tool namespace is closed");
        }
        Entry entry = entries.get(toolName);
        if (entry == null) {
            log.warn("LLM requested unknown tool [tool={}, available={}]", toolName, entries.keySet());
            return ToolResult.failure("Unknown tool: '" + toolName + "'. Available tools: " + entries.keySet());
        }
        return supervisor.invoke(entry.lease(), toolName, arguments);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            leases.forEach(supervisor::release);
        }
    }
}
