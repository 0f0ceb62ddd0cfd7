package com.localllm.agent.transport;

import com.localllm.agent.tool.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * One live channel to a tool-provider.
 *
 * Failures are split in two: {@link com.localllm.agent.exception.TransportException}
 * means the channel itself is unhealthy, {@link com.localllm.agent.exception.ToolInvocationException}
 * means the provider answered but the call failed. Callers degrade the
 * connection only on the former.
 */
public interface ToolTransport extends AutoCloseable {

    String providerId();

    /** Opens the channel and completes the MCP initialize handshake. */
    void connect();

    List<ToolDefinition> listTools();

    ToolResult callTool(String toolName, Map<String, Object> arguments);

    /** False when calls must be serialized on this channel. */
    boolean supportsConcurrentCalls();

    /** Idempotent. Never throws. */
    @Override
    void close();
}
