package com.localllm.agent.exception;

/**
 * Base for every failure raised by the orchestration core.
 *
 * Unchecked on purpose: call sites that can degrade gracefully catch the
 * specific subtype, everything else bubbles up to the gateway or the
 * REST advice.
 *
 * {@link #isRetryable()} drives the turn-level retry policy: only
 * retryable failures are attempted again, and only before any output
 * reached the client.
 */
public class AgentException extends RuntimeException {

    private final boolean retryable;

    public AgentException(String message) {
        this(message, null, false);
    }

    public AgentException(String message, Throwable cause) {
        this(message, cause, false);
    }

    protected AgentException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
