package com.localllm.agent.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client-to-server message: {@code user_turn {content, selectedProviderIds}} or {@code cancel {}}.
 * Fields may sit under {@code payload} or at the top level.
 */
public record ClientMessage(Type type, String content, List<String> selectedProviderIds) {

    public enum Type {
        USER_TURN,
        CANCEL
    }

    public static Optional<ClientMessage> parse(String raw, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode body = root.path("payload").isObject() ? root.path("payload") : root;
        String type = root.path("type").asText("");
        switch (type) {
            case "cancel":
                return Optional.of(new ClientMessage(Type.CANCEL, null, null));
            case "user_turn": {
                JsonNode content = body.get("content");
                if (content == null || !content.isTextual() || content.asText().isBlank()) {
                    return Optional.empty();
                }
                List<String> selection = null;
                JsonNode ids = body.get("selectedProviderIds");
                if (ids != null && !ids.isNull()) {
                    if (!ids.isArray()) {
                        return Optional.empty();
                    }
                    selection = new ArrayList<>();
                    for (JsonNode id : ids) {
                        selection.add(id.asText());
                    }
                }
                return Optional.of(new ClientMessage(Type.USER_TURN, content.asText(), selection));
            }
            default:
                return Optional.empty();
        }
    }
}
