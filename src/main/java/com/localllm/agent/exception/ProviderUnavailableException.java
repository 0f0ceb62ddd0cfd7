package com.localllm.agent.exception;

/**
 * Connecting to a provider failed after the configured attempt budget,
 * or the provider is disabled. The conversation continues without its tools.
 */
public class ProviderUnavailableException extends AgentException {

    private final String providerId;

    public ProviderUnavailableException(String providerId, String message) {
        this(providerId, message, null);
    }

    public ProviderUnavailableException(String providerId, String message, Throwable cause) {
        super("Provider '" + providerId + "' unavailable: " + message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
