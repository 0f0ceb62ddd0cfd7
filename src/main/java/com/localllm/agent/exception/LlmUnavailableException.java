package com.localllm.agent.exception;

/** LLM runtime unreachable, rate limited or returning 5xx. Retryable. */
public class LlmUnavailableException extends AgentException {

    public LlmUnavailableException(String message) {
        super(message, null, true);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
