package com.localllm.agent.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.config.AgentProperties;
import com.localllm.agent.gateway.ConversationChannel;
import com.localllm.agent.gateway.StreamMessageType;
import com.localllm.agent.model.Message;
import com.localllm.agent.resilience.ResilientTurnExecutor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates, tracks and destroys conversation sessions.
 *
 * A session survives a dropped socket for the reconnect grace period so a
 * client can resume; the sweeper destroys sessions that stay detached longer,
 * or that saw no client activity within the idle timeout.
 */
@Service
@Slf4j
public class ConversationSessionManager {

    static final String SYSTEM_PROMPT = """
            You are a research and analytics assistant. You answer questions about the
            user's data by calling the tools that are available to you.

            When given a task:
            1. Think step-by-step about what data you need
            2. Use the tools to fetch or compute it; prefer one precise query over many broad ones
            3. Provide a clear, concise final answer that cites the numbers you used

            Rules:
            - Only call tools that are listed. If no tool fits, say so.
            - If a tool returns an error, do NOT call the same tool again with the same arguments.
              Explain the limitation or try a different approach.
            - Be concise and actionable.
            """;

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final ConversationHistoryStore historyStore;
    private final ResilientTurnExecutor resilientTurnExecutor;
    private final ObjectMapper objectMapper;
    private final AgentProperties.Session settings;

    public ConversationSessionManager(ConversationHistoryStore historyStore,
                                      ResilientTurnExecutor resilientTurnExecutor,
                                      ObjectMapper objectMapper,
                                      AgentProperties properties) {
        this.historyStore = historyStore;
        this.resilientTurnExecutor = resilientTurnExecutor;
        this.objectMapper = objectMapper;
        this.settings = properties.getSession();
    }

    public ConversationSession attach(String conversationId, WebSocketSession socket) {
        ConversationSession session = sessions.computeIfAbsent(conversationId, this::create);
        session.channel().attach(socket);
        session.markAttached();
        log.info("Client attached [conversationId={}, socket={}, lastSeq={}]",
                conversationId, socket.getId(), session.channel().lastSeq());
        return session;
    }

    public void detach(String conversationId, WebSocketSession socket) {
        ConversationSession session = sessions.get(conversationId);
        if (session != null && session.channel().detach(socket)) {
            session.markDetached();
            log.info("Client detached [conversationId={}, socket={}]", conversationId, socket.getId());
        }
    }

    public Optional<ConversationSession> find(String conversationId) {
        return Optional.ofNullable(sessions.get(conversationId));
    }

    public int activeSessions() {
        return sessions.size();
    }

    public void destroy(String conversationId, String reason) {
        ConversationSession session = sessions.remove(conversationId);
        if (session == null) {
            return;
        }
        session.destroy();
        session.channel().close(CloseStatus.GOING_AWAY.withReason(reason));
        resilientTurnExecutor.removeBreaker(conversationId);
        log.info("Conversation destroyed [conversationId={}, reason={}]", conversationId, reason);
    }

    // ─── Background ─────────────────────────────────────────────────────────

    @Scheduled(fixedRateString = "${agent.session.heartbeat-interval:PT30S}")
    public void sendHeartbeats() {
        for (ConversationSession session : sessions.values()) {
            if (session.channel().isAttached()) {
                session.channel().send(StreamMessageType.HEARTBEAT, Map.of());
            }
        }
    }

    @Scheduled(fixedDelayString = "${agent.session.sweep-interval:PT15S}")
    public void sweep() {
        try {
            sweep(Instant.now());
        } catch (RuntimeException e) {
            log.error("Session sweep failed: {}", e.getMessage(), e);
        }
    }

    void sweep(Instant now) {
        for (ConversationSession session : List.copyOf(sessions.values())) {
            Instant detached = session.detachedSince();
            if (detached != null && detached.plus(settings.getReconnectGrace()).isBefore(now)) {
                destroy(session.id(), "client did not reconnect");
            } else if (session.streamingState() == StreamingState.IDLE
                    && session.lastActivity().plus(settings.getIdleTimeout()).isBefore(now)) {
                destroy(session.id(), "idle timeout");
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        List.copyOf(sessions.keySet()).forEach(id -> destroy(id, "server shutdown"));
    }

    private ConversationSession create(String conversationId) {
        List<Message> history = new ArrayList<>();
        history.add(Message.system(SYSTEM_PROMPT));
        List<Message> stored = historyStore.load(conversationId);
        stored.stream().filter(m -> m.getRole() != Message.Role.system).forEach(history::add);
        log.info("Conversation opened [conversationId={}, restoredMessages={}]", conversationId, history.size() - 1);
        return new ConversationSession(conversationId,
                new ConversationChannel(conversationId, objectMapper), history, settings.getHistoryLimit());
    }
}
