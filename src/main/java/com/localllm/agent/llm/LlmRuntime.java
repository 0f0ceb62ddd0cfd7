package com.localllm.agent.llm;

import com.localllm.agent.model.Message;
import com.localllm.agent.tool.ToolDefinition;

import java.util.List;

public interface LlmRuntime {

    /**
     * Starts a streamed completion for the conversation so far.
     *
     * @param messages full conversation (system + user + assistant + tool results)
     * @param tools    tools the LLM may call; empty means plain chat
     */
    LlmStream stream(List<Message> messages, List<ToolDefinition> tools);

    String modelName();
}
