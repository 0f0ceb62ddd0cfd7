package com.localllm.agent.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.gateway.ConversationChannel;
import com.localllm.agent.model.Message;
import com.localllm.agent.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryWindowTest {

    private static final ToolCall QUERY = ToolCall.builder()
            .id("call_1").toolName("mssql__query").arguments(Map.of()).build();

    private static Message toolRequest() {
        return Message.builder().role(Message.Role.assistant).toolCalls(List.of(QUERY)).build();
    }

    @Test
    void apply_underLimit_returnsSameMessages() {
        List<Message> messages = List.of(Message.system("sys"), Message.user("hi"), Message.assistant("hello"));

        assertThat(HistoryWindow.apply(messages, 10)).isSameAs(messages);
    }

    @Test
    void apply_overLimit_keepsSystemAndMostRecent() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("sys"));
        for (int i = 0; i < 10; i++) {
            messages.add(Message.user("q" + i));
            messages.add(Message.assistant("a" + i));
        }

        List<Message> window = HistoryWindow.apply(messages, 5);

        assertThat(window).extracting(Message::getContent).containsExactly("sys", "q8", "a8", "q9", "a9");
    }

    @Test
    void apply_cutThroughToolExchange_dropsOrphanedResults() {
        List<Message> messages = List.of(
                Message.system("sys"),
                Message.user("how many rows?"),
                toolRequest(),
                Message.toolResult(QUERY, "42"),
                Message.toolResult(QUERY, "43"),
                Message.assistant("42 rows"),
                Message.user("thanks"));

        List<Message> window = HistoryWindow.apply(messages, 4);

        assertThat(window).extracting(Message::getRole)
                .containsExactly(Message.Role.system, Message.Role.assistant, Message.Role.user);
        assertThat(window.get(1).getContent()).isEqualTo("42 rows");
    }

    @Test
    void apply_withoutSystemMessage_usesWholeBudget() {
        List<Message> messages = List.of(Message.user("q1"), Message.assistant("a1"), Message.user("q2"));

        assertThat(HistoryWindow.apply(messages, 2)).extracting(Message::getContent).containsExactly("a1", "q2");
    }

    @Test
    void session_appendBeyondLimit_staysBounded() {
        ConversationSession session = new ConversationSession("c1",
                new ConversationChannel("c1", new ObjectMapper()), List.of(Message.system("sys")), 5);

        for (int i = 0; i < 20; i++) {
            session.appendHistory(List.of(Message.user("q" + i), toolRequest(),
                    Message.toolResult(QUERY, "r" + i), Message.assistant("a" + i)));
        }

        List<Message> history = session.historySnapshot();
        assertThat(history).hasSizeLessThanOrEqualTo(5);
        assertThat(history.get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(history.get(1).getRole()).isNotEqualTo(Message.Role.tool);
        assertThat(history).last().extracting(Message::getContent).isEqualTo("a19");
    }
}
