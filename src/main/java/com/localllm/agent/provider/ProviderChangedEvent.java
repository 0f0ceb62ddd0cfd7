package com.localllm.agent.provider;

/**
 * Published by {@link ProviderRegistry} after a mutation has been persisted
 * and the new snapshot is visible. Listeners must not call back into the
 * registry's write methods.
 */
public record ProviderChangedEvent(String providerId, Change change) {

    public enum Change {
        ADDED,
        UPDATED,
        REMOVED,
        ENABLED,
        DISABLED
    }
}
