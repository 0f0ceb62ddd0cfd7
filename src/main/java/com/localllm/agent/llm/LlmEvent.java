package com.localllm.agent.llm;

import com.localllm.agent.model.ToolCall;

import java.util.List;

/** What the LLM stream yields: text as it is generated, or a batch of tool calls. */
public sealed interface LlmEvent permits LlmEvent.TextToken, LlmEvent.ToolCallBatch {

    record TextToken(String text) implements LlmEvent {
    }

    /**
     * Tool calls requested in one reply. {@code independent} means the calls
     * may run concurrently; otherwise they run in order.
     */
    record ToolCallBatch(List<ToolCall> calls, boolean independent) implements LlmEvent {

        public ToolCallBatch {
            calls = List.copyOf(calls);
        }
    }
}
