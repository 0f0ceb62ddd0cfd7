package com.localllm.agent.exception;

/** Attempted removal of a built-in provider. Built-ins can only be disabled or reconfigured. */
public class ImmutableProviderException extends AgentException {

    public ImmutableProviderException(String providerId) {
        super("Provider '" + providerId + "' is built-in and cannot be removed");
    }
}
