package com.localllm.agent.supervisor;

import java.time.Instant;

/** Read-only view of a provider's live connection. */
public record ConnectionStatus(
        String providerId,
        ConnectionState state,
        String lastError,
        int toolCount,
        int attachedConversations,
        Instant lastActivity) {

    static ConnectionStatus idle(String providerId) {
        return new ConnectionStatus(providerId, ConnectionState.DISCONNECTED, null, 0, 0, null);
    }
}
