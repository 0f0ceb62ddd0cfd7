package com.localllm.agent.session;

import com.localllm.agent.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Sliding window over conversation history.
 *
 * Always preserves a leading system message and keeps the most recent
 * messages after it. The window never starts on a tool result: a result
 * whose assistant tool_calls message fell out of the window is dropped too,
 * since OpenAI-compatible backends reject such a history.
 */
@Slf4j
final class HistoryWindow {

    private HistoryWindow() {
    }

    static List<Message> apply(List<Message> messages, int maxMessages) {
        boolean hasSystem = !messages.isEmpty() && messages.get(0).getRole() == Message.Role.system;
        List<Message> rest = hasSystem ? messages.subList(1, messages.size()) : messages;
        int budget = Math.max(0, hasSystem ? maxMessages - 1 : maxMessages);

        int from = Math.max(0, rest.size() - budget);
        from += leadingToolResults(rest.subList(from, rest.size()));
        if (from == 0) {
            return messages;
        }

        List<Message> result = new ArrayList<>(budget + 1);
        if (hasSystem) {
            result.add(messages.get(0));
        }
        result.addAll(rest.subList(from, rest.size()));
        log.debug("Applied sliding window: {} → {} messages", messages.size(), result.size());
        return result;
    }

    /** Number of tool results at the head of {@code messages}. */
    static int leadingToolResults(List<Message> messages) {
        int count = 0;
        while (count < messages.size() && messages.get(count).getRole() == Message.Role.tool) {
            count++;
        }
        return count;
    }
}
