package com.localllm.agent.exception;

/**
 * A specific tool call failed at the provider (JSON-RPC error reply).
 * Surfaced to the LLM as a tool result, never to the client as a protocol error.
 */
public class ToolInvocationException extends AgentException {

    private final int code;

    public ToolInvocationException(String toolName, int code, String message) {
        super("Tool '" + toolName + "' failed [" + code + "]: " + message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
