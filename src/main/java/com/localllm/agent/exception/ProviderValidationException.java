package com.localllm.agent.exception;

/** Bad provider configuration. Caller's fault, never retried, never persisted. */
public class ProviderValidationException extends AgentException {

    public ProviderValidationException(String message) {
        super(message);
    }
}
