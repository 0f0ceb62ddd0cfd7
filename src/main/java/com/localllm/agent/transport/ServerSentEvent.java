package com.localllm.agent.transport;

/** One dispatched event from a text/event-stream body. */
public record ServerSentEvent(String event, String data, String id) {

    public static final String DEFAULT_EVENT = "message";
}
