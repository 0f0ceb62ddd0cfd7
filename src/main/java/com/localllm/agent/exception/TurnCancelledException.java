package com.localllm.agent.exception;

/** Cooperative cancellation observed at a suspension point. */
public class TurnCancelledException extends AgentException {

    public TurnCancelledException(String conversationId) {
        super("Turn cancelled [conversationId=" + conversationId + "]");
    }
}
