package com.localllm.agent.tool;

import com.localllm.agent.exception.ProviderUnavailableException;
import com.localllm.agent.supervisor.ConnectionLease;
import com.localllm.agent.supervisor.ConnectionSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Builds a conversation's tool namespace from the providers it selected.
 *
 * Design decisions:
 * - Tools keep their raw names; the LLM never sees provider prefixes.
 * - On a name collision the provider listed later wins, one warning per collision.
 * - A provider that cannot be reached is skipped with a warning; the rest of the
 *   namespace is still built.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CapabilityAggregator {

    private final ConnectionSupervisor supervisor;

    public ToolNamespace buildNamespace(List<String> providerIds) {
        List<String> selection = new ArrayList<>(new LinkedHashSet<>(providerIds != null ? providerIds : List.of()));
        Map<String, ToolNamespace.Entry> entries = new LinkedHashMap<>();
        List<ConnectionLease> leases = new ArrayList<>();

        for (String providerId : selection) {
            ConnectionLease lease;
            try {
                lease = supervisor.acquire(providerId);
            } catch (ProviderUnavailableException e) {
                log.warn("Skipping provider for this conversation [provider={}]: {}", providerId, e.getMessage());
                continue;
            }
            leases.add(lease);
            for (ToolDefinition tool : supervisor.capabilities(lease)) {
                ToolNamespace.Entry previous = entries.remove(tool.getName());
                if (previous != null && !previous.providerId().equals(providerId)) {
                    log.warn("Tool name collision [tool={}]: provider '{}' overrides '{}'",
                            tool.getName(), providerId, previous.providerId());
                }
                entries.put(tool.getName(), new ToolNamespace.Entry(providerId, tool, lease));
            }
        }

        log.info("Tool namespace built [providers={}, connected={}, tools={}]",
                selection, leases.size(), entries.size());
        return new ToolNamespace(selection, entries, leases, supervisor);
    }
}
