package com.localllm.agent.gateway;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StreamMessageType {

    TOKEN("token"),
    TOOL_CALL_STARTED("tool_call_started"),
    TOOL_CALL_RESULT("tool_call_result"),
    ERROR("error"),
    TURN_COMPLETE("turn_complete"),
    TURN_CANCELLED("turn_cancelled"),
    HEARTBEAT("heartbeat");

    private final String wireName;

    StreamMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminator() {
        return this == TURN_COMPLETE || this == TURN_CANCELLED || this == ERROR;
    }
}
