package com.localllm.agent.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.core.AgentTurnRunner;
import com.localllm.agent.core.TurnOutcome;
import com.localllm.agent.core.TurnSink;
import com.localllm.agent.core.TurnState;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.TurnCancelledException;
import com.localllm.agent.model.Message;
import com.localllm.agent.resilience.ResilientTurnExecutor;
import com.localllm.agent.session.ConversationHistoryStore;
import com.localllm.agent.session.ConversationSession;
import com.localllm.agent.session.ConversationSessionManager;
import com.localllm.agent.tool.CapabilityAggregator;
import com.localllm.agent.tool.ToolNamespace;
import com.localllm.agent.transport.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns client messages into turns and turn output into stream messages.
 *
 * Every accepted user_turn ends with exactly one of turn_complete,
 * turn_cancelled or error; the terminator is sent from a finally path so no
 * failure mode can skip it.
 */
@Service
@Slf4j
public class StreamingSessionGateway {

    private final ConversationSessionManager sessionManager;
    private final CapabilityAggregator aggregator;
    private final AgentTurnRunner turnRunner;
    private final ResilientTurnExecutor resilientTurnExecutor;
    private final ConversationHistoryStore historyStore;
    private final TaskExecutor conversationExecutor;
    private final ObjectMapper objectMapper;

    public StreamingSessionGateway(ConversationSessionManager sessionManager,
                                   CapabilityAggregator aggregator,
                                   AgentTurnRunner turnRunner,
                                   ResilientTurnExecutor resilientTurnExecutor,
                                   ConversationHistoryStore historyStore,
                                   @Qualifier("conversationTaskExecutor") TaskExecutor conversationExecutor,
                                   ObjectMapper objectMapper) {
        this.sessionManager = sessionManager;
        this.aggregator = aggregator;
        this.turnRunner = turnRunner;
        this.resilientTurnExecutor = resilientTurnExecutor;
        this.historyStore = historyStore;
        this.conversationExecutor = conversationExecutor;
        this.objectMapper = objectMapper;
    }

    public void onClientMessage(ConversationSession session, String raw) {
        session.touch();
        Optional<ClientMessage> parsed = ClientMessage.parse(raw, objectMapper);
        if (parsed.isEmpty()) {
            log.warn("Malformed client message [conversationId={}]", session.id());
            sendError(session, "Malformed message: expected user_turn {content, selectedProviderIds} or cancel", false);
            return;
        }
        ClientMessage message = parsed.get();
        switch (message.type()) {
            case USER_TURN -> startTurn(session, message.content(), message.selectedProviderIds());
            case CANCEL -> cancel(session);
        }
    }

    public void startTurn(ConversationSession session, String content, List<String> selection) {
        TurnState turn = session.tryBeginTurn();
        if (turn == null) {
            sendError(session, "A turn is already in progress for this conversation", true);
            return;
        }
        try {
            conversationExecutor.execute(() -> runTurn(session, turn, content, selection));
        } catch (TaskRejectedException e) {
            log.error("Turn rejected, executor saturated [conversationId={}]", session.id());
            session.endTurn(turn);
            sendError(session, "Server is busy, please retry", true);
        }
    }

    public void cancel(ConversationSession session) {
        if (session.requestCancel()) {
            log.info("Cancel requested [conversationId={}]", session.id());
        } else {
            log.debug("Cancel ignored, no turn running [conversationId={}]", session.id());
        }
    }

    void runTurn(ConversationSession session, TurnState turn, String content, List<String> selection) {
        String conversationId = session.id();
        Message userMessage = Message.user(content);
        StreamMessageType terminator = StreamMessageType.ERROR;
        Map<String, Object> terminatorPayload = errorPayload("Turn failed", false);
        try {
            ToolNamespace namespace = session.namespaceFor(selection, aggregator);
            List<Message> history = session.historySnapshot();
            TurnSink sink = new ChannelSink(session.channel());

            TurnOutcome outcome = resilientTurnExecutor.execute(turn,
                    () -> turnRunner.run(history, userMessage, namespace, sink, turn));

            record(session, outcome.newMessages());
            terminator = StreamMessageType.TURN_COMPLETE;
            terminatorPayload = Map.of();
        } catch (TurnCancelledException e) {
            record(session, List.of(userMessage));
            terminator = StreamMessageType.TURN_CANCELLED;
            terminatorPayload = Map.of();
        } catch (AgentException e) {
            record(session, List.of(userMessage));
            if (turn.isCancelled()) {
                terminator = StreamMessageType.TURN_CANCELLED;
                terminatorPayload = Map.of();
            } else {
                log.error("Turn failed [conversationId={}]: {}", conversationId, e.getMessage());
                terminatorPayload = errorPayload(e.getMessage(), e.isRetryable() && !turn.isOutputEmitted());
            }
        } catch (RuntimeException e) {
            log.error("Turn failed unexpectedly [conversationId={}]", conversationId, e);
            terminatorPayload = errorPayload("Internal error: " + e.getMessage(), false);
        } finally {
            // terminator first: the next turn may only start once this one is closed on the wire
            try {
                session.channel().send(terminator, terminatorPayload);
            } finally {
                session.endTurn(turn);
            }
        }
    }

    private void record(ConversationSession session, List<Message> messages) {
        session.appendHistory(messages);
        historyStore.append(session.id(), messages);
    }

    private void sendError(ConversationSession session, String message, boolean retryable) {
        session.channel().send(StreamMessageType.ERROR, errorPayload(message, retryable));
    }

    private static Map<String, Object> errorPayload(String message, boolean retryable) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message != null ? message : "Unknown error");
        payload.put("retryable", retryable);
        return payload;
    }

    /** Relays turn output onto the conversation's channel. */
    private static final class ChannelSink implements TurnSink {

        private final ConversationChannel channel;

        ChannelSink(ConversationChannel channel) {
            this.channel = channel;
        }

        @Override
        public void onToken(String text) {
            channel.send(StreamMessageType.TOKEN, Map.of("content", text));
        }

        @Override
        public void onToolCallStarted(String callId, String toolName, Map<String, Object> arguments) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("callId", callId);
            payload.put("name", toolName);
            payload.put("args", arguments != null ? arguments : Map.of());
            channel.send(StreamMessageType.TOOL_CALL_STARTED, payload);
        }

        @Override
        public void onToolCallResult(String callId, String toolName, ToolResult result) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("callId", callId);
            payload.put("name", toolName);
            payload.put("result", result.content());
            payload.put("isError", result.error());
            channel.send(StreamMessageType.TOOL_CALL_RESULT, payload);
        }
    }
}
