package com.localllm.agent.core;

import com.localllm.agent.transport.ToolResult;

import java.util.Map;

/** Receives a turn's output as it is produced. Implementations must be thread-safe. */
public interface TurnSink {

    void onToken(String text);

    void onToolCallStarted(String callId, String toolName, Map<String, Object> arguments);

    void onToolCallResult(String callId, String toolName, ToolResult result);
}
