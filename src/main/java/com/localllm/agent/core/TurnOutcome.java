package com.localllm.agent.core;

import com.localllm.agent.model.Message;

import java.util.List;

/**
 * Result of a completed turn. {@code newMessages} are the messages the turn
 * produced, to be appended to the conversation history.
 */
public record TurnOutcome(List<Message> newMessages, String finalAnswer, int iterationsUsed, boolean maxIterationsReached) {

    public TurnOutcome {
        newMessages = List.copyOf(newMessages);
    }
}
