package com.localllm.agent.transport;

/**
 * Outcome of one tool call as the LLM will see it.
 * {@code error} results are still fed back to the model, never thrown.
 */
public record ToolResult(String content, boolean error) {

    public static ToolResult success(String content) {
        return new ToolResult(content != null ? content : "", false);
    }

    public static ToolResult failure(String message) {
        return new ToolResult(message != null ? message : "Tool call failed", true);
    }
}
