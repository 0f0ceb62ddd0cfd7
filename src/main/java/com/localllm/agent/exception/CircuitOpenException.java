package com.localllm.agent.exception;

/** Fast-fail while the conversation's circuit breaker is open. */
public class CircuitOpenException extends AgentException {

    public CircuitOpenException(String path, Throwable cause) {
        super("Circuit breaker open for " + path + " - try again shortly", cause, true);
    }
}
