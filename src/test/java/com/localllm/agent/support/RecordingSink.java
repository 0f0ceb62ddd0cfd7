package com.localllm.agent.support;

import com.localllm.agent.core.TurnSink;
import com.localllm.agent.transport.ToolResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Records sink callbacks as "token:..", "started:id:name" and "result:id:content". */
public class RecordingSink implements TurnSink {

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onToken(String text) {
        events.add("token:" + text);
    }

    @Override
    public void onToolCallStarted(String callId, String toolName, Map<String, Object> arguments) {
        events.add("started:" + callId + ":" + toolName);
    }

    @Override
    public void onToolCallResult(String callId, String toolName, ToolResult result) {
        events.add("result:" + callId + ":" + result.content());
    }

    public List<String> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
