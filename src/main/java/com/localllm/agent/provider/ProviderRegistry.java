package com.localllm.agent.provider;

import com.localllm.agent.config.AgentProperties;
import com.localllm.agent.exception.ImmutableProviderException;
import com.localllm.agent.exception.ProviderNotFoundException;
import com.localllm.agent.exception.ProviderValidationException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Durable catalogue of tool-provider configurations.
 *
 * Design decisions:
 * - Readers get an immutable snapshot through a volatile field; no lock on the read path.
 * - Writers are serialized on {@link #writeLock}. Each write builds the next snapshot,
 *   persists it, and only then publishes it. A failed save leaves the old snapshot in place.
 * - Every mutation publishes a {@link ProviderChangedEvent}; the connection supervisor
 *   retires the affected connection. Nothing is closed from here.
 */
@Service
@Slf4j
public class ProviderRegistry {

    private final ProviderConfigStore store;
    private final ApplicationEventPublisher events;
    private final boolean includeBuiltIns;

    private final Object writeLock = new Object();
    private volatile Map<String, ProviderConfig> snapshot = Map.of();

    public ProviderRegistry(ProviderConfigStore store,
                            ApplicationEventPublisher events,
                            AgentProperties properties) {
        this(store, events, properties.getProviders().isIncludeBuiltIns());
    }

    public ProviderRegistry(ProviderConfigStore store,
                            ApplicationEventPublisher events,
                            boolean includeBuiltIns) {
        this.store = store;
        this.events = events;
        this.includeBuiltIns = includeBuiltIns;
    }

    @PostConstruct
    public void init() {
        synchronized (writeLock) {
            snapshot = readFromStore();
        }
        log.info("Provider registry loaded [providers={}, enabled={}]",
                snapshot.size(), snapshot.values().stream().filter(ProviderConfig::isEnabled).count());
    }

    // ─── Reads ──────────────────────────────────────────────────────────────

    public List<ProviderConfig> list() {
        return List.copyOf(snapshot.values());
    }

    public ProviderConfig get(String providerId) {
        return find(providerId).orElseThrow(() -> new ProviderNotFoundException(providerId));
    }

    public Optional<ProviderConfig> find(String providerId) {
        return Optional.ofNullable(providerId).map(snapshot::get);
    }

    public boolean isBuiltIn(String providerId) {
        return find(providerId).map(ProviderConfig::isBuiltIn).orElse(false);
    }

    // ─── Writes ─────────────────────────────────────────────────────────────

    public ProviderConfig add(ProviderConfig config) {
        ProviderConfig candidate = ProviderConfigValidator.validate(config).toBuilder().builtIn(false).build();
        synchronized (writeLock) {
            if (snapshot.containsKey(candidate.getId())) {
                throw new ProviderValidationException("Provider '" + candidate.getId() + "' already exists");
            }
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.put(candidate.getId(), candidate);
            commit(next);
        }
        log.info("Provider added [provider={}, transport={}]", candidate.getId(), candidate.getTransport().wireName());
        events.publishEvent(new ProviderChangedEvent(candidate.getId(), ProviderChangedEvent.Change.ADDED));
        return candidate;
    }

    public ProviderConfig update(String providerId, ProviderPatch patch) {
        ProviderConfig updated;
        synchronized (writeLock) {
            ProviderConfig current = get(providerId);
            updated = ProviderConfigValidator.validate(patch.applyTo(current));
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.put(providerId, updated);
            commit(next);
        }
        log.info("Provider updated [provider={}, affectsConnection={}]", providerId, patch.affectsConnection());
        events.publishEvent(new ProviderChangedEvent(providerId, ProviderChangedEvent.Change.UPDATED));
        return updated;
    }

    public void remove(String providerId) {
        synchronized (writeLock) {
            ProviderConfig current = get(providerId);
            if (current.isBuiltIn()) {
                throw new ImmutableProviderException(providerId);
            }
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.remove(providerId);
            commit(next);
        }
        log.info("Provider removed [provider={}]", providerId);
        events.publishEvent(new ProviderChangedEvent(providerId, ProviderChangedEvent.Change.REMOVED));
    }

    public ProviderConfig setEnabled(String providerId, boolean enabled) {
        ProviderConfig updated;
        synchronized (writeLock) {
            ProviderConfig current = get(providerId);
            if (current.isEnabled() == enabled) {
                return current;
            }
            updated = current.toBuilder().enabled(enabled).build();
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.put(providerId, updated);
            commit(next);
        }
        log.info("Provider {} [provider={}]", enabled ? "enabled" : "disabled", providerId);
        events.publishEvent(new ProviderChangedEvent(providerId,
                enabled ? ProviderChangedEvent.Change.ENABLED : ProviderChangedEvent.Change.DISABLED));
        return updated;
    }

    /**
     * Re-reads the config file. Providers whose effective config differs from
     * the current snapshot (or that appeared or vanished) are reported as changed.
     */
    public List<String> reload() {
        List<ProviderChangedEvent> changes = new ArrayList<>();
        synchronized (writeLock) {
            Map<String, ProviderConfig> previous = snapshot;
            Map<String, ProviderConfig> next = readFromStore();
            next.forEach((id, config) -> {
                ProviderConfig old = previous.get(id);
                if (old == null) {
                    changes.add(new ProviderChangedEvent(id, ProviderChangedEvent.Change.ADDED));
                } else if (!Objects.equals(old, config)) {
                    changes.add(new ProviderChangedEvent(id, ProviderChangedEvent.Change.UPDATED));
                }
            });
            previous.keySet().stream()
                    .filter(id -> !next.containsKey(id))
                    .forEach(id -> changes.add(new ProviderChangedEvent(id, ProviderChangedEvent.Change.REMOVED)));
            snapshot = next;
        }
        log.info("Provider registry reloaded [providers={}, changed={}]", snapshot.size(), changes.size());
        changes.forEach(events::publishEvent);
        return changes.stream().map(ProviderChangedEvent::providerId).toList();
    }

    // ─── Internals ──────────────────────────────────────────────────────────

    private void commit(Map<String, ProviderConfig> next) {
        store.save(next.values());
        snapshot = Collections.unmodifiableMap(next);
    }

    private Map<String, ProviderConfig> readFromStore() {
        Map<String, ProviderConfig> next = new LinkedHashMap<>();
        if (includeBuiltIns) {
            BuiltInProviders.list().forEach(p -> next.put(p.getId(), p));
        }
        store.load().forEach((id, entry) -> {
            ProviderConfig base = next.get(id);
            try {
                ProviderConfig config = ProviderConfigValidator.validate(entry.toConfig(id, base));
                next.put(id, base != null ? config.toBuilder().builtIn(true).build() : config);
            } catch (ProviderValidationException e) {
                log.warn("Skipping invalid provider entry [provider={}]: {}", id, e.getMessage());
            }
        });
        return Collections.unmodifiableMap(next);
    }
}
