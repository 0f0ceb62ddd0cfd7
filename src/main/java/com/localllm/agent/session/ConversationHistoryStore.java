package com.localllm.agent.session;

import com.localllm.agent.model.Message;

import java.util.List;

/** Durable conversation history. Appends are fire-and-forget and never throw to the caller. */
public interface ConversationHistoryStore {

    void append(String conversationId, List<Message> messages);

    List<Message> load(String conversationId);

    void clear(String conversationId);
}
