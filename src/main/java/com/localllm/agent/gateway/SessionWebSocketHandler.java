package com.localllm.agent.gateway;

import com.localllm.agent.session.ConversationSession;
import com.localllm.agent.session.ConversationSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriTemplate;

import java.util.Map;

/**
 * WebSocket binding at /ws/conversations/{conversationId}. One socket per
 * conversation at a time; a reconnect replaces the previous socket.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionWebSocketHandler extends TextWebSocketHandler {

    public static final String PATH = "/ws/conversations/{conversationId}";

    private static final UriTemplate PATH_TEMPLATE = new UriTemplate(PATH);
    private static final String CONVERSATION_ATTR = "conversationId";
    private static final String DECORATED_ATTR = "decoratedSession";
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ConversationSessionManager sessionManager;
    private final StreamingSessionGateway gateway;

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws Exception {
        String conversationId = conversationId(socket);
        if (conversationId == null || conversationId.isBlank()) {
            socket.close(CloseStatus.BAD_DATA.withReason("Missing conversation id"));
            return;
        }
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        socket.getAttributes().put(CONVERSATION_ATTR, conversationId);
        socket.getAttributes().put(DECORATED_ATTR, decorated);
        sessionManager.attach(conversationId, decorated);
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        String conversationId = (String) socket.getAttributes().get(CONVERSATION_ATTR);
        ConversationSession session = sessionManager.find(conversationId).orElse(null);
        if (session == null) {
            // destroyed by the sweeper while the socket stayed open: start over
            session = sessionManager.attach(conversationId, decorated(socket));
        }
        gateway.onClientMessage(session, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        log.warn("WebSocket transport error [conversationId={}]: {}",
                socket.getAttributes().get(CONVERSATION_ATTR), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        String conversationId = (String) socket.getAttributes().get(CONVERSATION_ATTR);
        if (conversationId != null) {
            sessionManager.detach(conversationId, decorated(socket));
        }
        log.debug("WebSocket closed [conversationId={}, status={}]", conversationId, status);
    }

    private static WebSocketSession decorated(WebSocketSession socket) {
        Object decorated = socket.getAttributes().get(DECORATED_ATTR);
        return decorated instanceof WebSocketSession ws ? ws : socket;
    }

    private static String conversationId(WebSocketSession socket) {
        if (socket.getUri() == null || !PATH_TEMPLATE.matches(socket.getUri().getPath())) {
            return null;
        }
        Map<String, String> vars = PATH_TEMPLATE.match(socket.getUri().getPath());
        return vars.get("conversationId");
    }
}
