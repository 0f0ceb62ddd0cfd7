package com.localllm.agent.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

/**
 * Outbound side of one conversation. Sequence numbers are assigned and the
 * frame is written under one lock, so frames leave in sequence order.
 * While no socket is attached, messages are dropped but still consume a number.
 */
@Slf4j
public class ConversationChannel {

    private final String conversationId;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    private long seq;
    private WebSocketSession socket;

    public ConversationChannel(String conversationId, ObjectMapper objectMapper) {
        this.conversationId = conversationId;
        this.objectMapper = objectMapper;
    }

    public long send(StreamMessageType type, Map<String, Object> payload) {
        synchronized (lock) {
            StreamMessage message = new StreamMessage(conversationId, ++seq, type, payload != null ? payload : Map.of());
            if (socket == null || !socket.isOpen()) {
                log.debug("Dropping {} while detached [conversationId={}, seq={}]", type.wireName(), conversationId, seq);
                return seq;
            }
            try {
                socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
            } catch (JsonProcessingException e) {
                log.error("Could not encode {} [conversationId={}]", type.wireName(), conversationId, e);
            } catch (IOException | IllegalStateException e) {
                log.warn("Send failed, detaching socket [conversationId={}, seq={}]: {}", conversationId, seq, e.getMessage());
                socket = null;
            }
            return seq;
        }
    }

    /** Attaches a socket, replacing (and closing) a previous one. */
    public void attach(WebSocketSession newSocket) {
        WebSocketSession previous;
        synchronized (lock) {
            previous = socket;
            socket = newSocket;
        }
        if (previous != null && previous != newSocket && previous.isOpen()) {
            try {
                previous.close(CloseStatus.NORMAL.withReason("Replaced by a newer connection"));
            } catch (IOException e) {
                log.debug("Closing replaced socket failed [conversationId={}]: {}", conversationId, e.getMessage());
            }
        }
    }

    /** Detaches only if {@code closing} is the current socket. */
    public boolean detach(WebSocketSession closing) {
        synchronized (lock) {
            if (socket != closing) {
                return false;
            }
            socket = null;
            return true;
        }
    }

    public boolean isAttached() {
        synchronized (lock) {
            return socket != null && socket.isOpen();
        }
    }

    public long lastSeq() {
        synchronized (lock) {
            return seq;
        }
    }

    public void close(CloseStatus status) {
        WebSocketSession current;
        synchronized (lock) {
            current = socket;
            socket = null;
        }
        if (current != null && current.isOpen()) {
            try {
                current.close(status);
            } catch (IOException e) {
                log.debug("Socket close failed [conversationId={}]: {}", conversationId, e.getMessage());
            }
        }
    }
}
