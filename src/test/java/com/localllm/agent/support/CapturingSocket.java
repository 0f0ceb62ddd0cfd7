package com.localllm.agent.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/** Mock WebSocket that records every frame sent to it as parsed JSON. */
public final class CapturingSocket {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebSocketSession session = mock(WebSocketSession.class,
            withSettings().strictness(Strictness.LENIENT));
    private final List<JsonNode> frames = new CopyOnWriteArrayList<>();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public CapturingSocket(String id) {
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenAnswer(invocation -> open.get());
        try {
            doAnswer(invocation -> {
                TextMessage message = invocation.getArgument(0);
                frames.add(parse(message.getPayload()));
                return null;
            }).when(session).sendMessage(any());
            doAnswer(invocation -> {
                open.set(false);
                return null;
            }).when(session).close(any(CloseStatus.class));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static JsonNode parse(String payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Frame is not JSON: " + payload, e);
        }
    }

    public WebSocketSession session() {
        return session;
    }

    public List<JsonNode> frames() {
        return List.copyOf(frames);
    }

    public List<String> types() {
        return frames.stream().map(f -> f.path("type").asText()).toList();
    }

    public long count(String type) {
        return types().stream().filter(type::equals).count();
    }

    public boolean isOpen() {
        return open.get();
    }
}
