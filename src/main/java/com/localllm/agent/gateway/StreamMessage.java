package com.localllm.agent.gateway;

import java.util.Map;

/** Server-to-client envelope. {@code seq} is strictly increasing per conversation. */
public record StreamMessage(String conversationId, long seq, StreamMessageType type, Map<String, Object> payload) {
}
