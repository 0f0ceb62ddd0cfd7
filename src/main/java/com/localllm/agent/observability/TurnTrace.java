package com.localllm.agent.observability;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-turn observability data, created when a turn starts and logged when
 * it ends. Kept apart from the turn state so metrics never leak into the loop.
 */
@Getter
public class TurnTrace {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();
    private int iterations;
    private int tokensStreamed;

    public synchronized void recordToolCall(String toolName, long latencyMs, boolean error) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, error));
    }

    public synchronized void nextIteration() {
        iterations++;
    }

    public synchronized void addToken() {
        tokensStreamed++;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public synchronized int toolCalls() {
        return toolCallRecords.size();
    }

    public synchronized long failedToolCalls() {
        return toolCallRecords.stream().filter(ToolCallRecord::error).count();
    }

    public record ToolCallRecord(String toolName, long latencyMs, boolean error) {
    }
}
