package com.localllm.agent.session;

public enum StreamingState {
    IDLE,
    GENERATING,
    CANCELLING
}
