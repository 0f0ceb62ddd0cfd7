package com.localllm.agent.exception;

public class ProviderNotFoundException extends AgentException {

    public ProviderNotFoundException(String providerId) {
        super("Provider not found: " + providerId);
    }
}
