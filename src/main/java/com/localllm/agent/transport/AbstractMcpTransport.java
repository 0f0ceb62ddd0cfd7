package com.localllm.agent.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.localllm.agent.exception.ToolInvocationException;
import com.localllm.agent.exception.TransportException;
import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.tool.ToolDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 / MCP conversation shared by every transport kind.
 * Subclasses only move framed messages; handshake, pagination and result
 * decoding live here.
 */
@Slf4j
public abstract class AbstractMcpTransport implements ToolTransport {

    private static final int MAX_TOOL_PAGES = 50;

    protected final ProviderConfig config;
    protected final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong();
    protected volatile boolean closed;

    protected AbstractMcpTransport(ProviderConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerId() {
        return config.getId();
    }

    @Override
    public final void connect() {
        ensureOpen();
        open();

        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", McpProtocol.PROTOCOL_VERSION);
        params.putObject("capabilities");
        params.putObject("clientInfo")
                .put("name", McpProtocol.CLIENT_NAME)
                .put("version", McpProtocol.CLIENT_VERSION);

        JsonNode result = call(McpProtocol.INITIALIZE, params);
        notify(McpProtocol.INITIALIZED);

        log.info("MCP handshake complete [provider={}, transport={}, server={}, protocol={}]",
                providerId(), config.getTransport().wireName(),
                result.path("serverInfo").path("name").asText("?"),
                result.path("protocolVersion").asText("?"));
    }

    @Override
    public List<ToolDefinition> listTools() {
        List<ToolDefinition> tools = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < MAX_TOOL_PAGES; page++) {
            ObjectNode params = objectMapper.createObjectNode();
            if (cursor != null) {
                params.put("cursor", cursor);
            }
            JsonNode result = call(McpProtocol.TOOLS_LIST, params);
            for (JsonNode tool : result.path("tools")) {
                tools.add(toDefinition(tool));
            }
            JsonNode next = result.get("nextCursor");
            if (next == null || next.isNull() || next.asText().isEmpty()) {
                return tools;
            }
            cursor = next.asText();
        }
        log.warn("tools/list pagination stopped after {} pages [provider={}]", MAX_TOOL_PAGES, providerId());
        return tools;
    }

    @Override
    public ToolResult callTool(String toolName, Map<String, Object> arguments) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", objectMapper.valueToTree(arguments != null ? arguments : Map.of()));

        JsonNode response = exchange(McpProtocol.TOOLS_CALL, params);
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new ToolInvocationException(toolName, error.path("code").asInt(),
                    error.path("message").asText("unknown error"));
        }
        JsonNode result = response.path("result");
        return new ToolResult(renderContent(result.path("content")), result.path("isError").asBoolean(false));
    }

    @Override
    public final void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            doClose();
        } catch (RuntimeException e) {
            log.warn("Error while closing transport [provider={}]: {}", providerId(), e.getMessage());
        }
        log.debug("Transport closed [provider={}]", providerId());
    }

    // ─── Subclass hooks ─────────────────────────────────────────────────────

    /** Opens the underlying channel; called once before the handshake. */
    protected abstract void open();

    /** Sends a request and blocks for its response message (result or error). */
    protected abstract JsonNode sendRequest(long id, ObjectNode request, Duration timeout);

    /** Sends a message that expects no response. */
    protected abstract void sendNotification(ObjectNode notification);

    protected abstract void doClose();

    // ─── Helpers ────────────────────────────────────────────────────────────

    protected Duration callTimeout() {
        return config.callTimeout();
    }

    protected void ensureOpen() {
        if (closed) {
            throw new TransportException("Transport already closed [provider=" + providerId() + "]");
        }
    }

    protected JsonNode parse(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TransportException("Malformed JSON-RPC message from provider " + providerId(), e);
        }
    }

    protected String serialize(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new TransportException("Could not serialize JSON-RPC message", e);
        }
    }

    /** Request whose JSON-RPC error is a transport-level failure. */
    private JsonNode call(String method, ObjectNode params) {
        JsonNode response = exchange(method, params);
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new TransportException(method + " rejected by provider " + providerId()
                    + ": [" + error.path("code").asInt() + "] " + error.path("message").asText());
        }
        return response.path("result");
    }

    private JsonNode exchange(String method, ObjectNode params) {
        ensureOpen();
        long id = requestIds.incrementAndGet();
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", McpProtocol.JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.set("params", params);
        log.debug("→ {} [provider={}, id={}]", method, providerId(), id);
        JsonNode response = sendRequest(id, request, callTimeout());
        if (response == null) {
            throw new TransportException("No response to " + method + " from provider " + providerId());
        }
        return response;
    }

    private void notify(String method) {
        ObjectNode notification = objectMapper.createObjectNode();
        notification.put("jsonrpc", McpProtocol.JSONRPC_VERSION);
        notification.put("method", method);
        sendNotification(notification);
    }

    private ToolDefinition toDefinition(JsonNode tool) {
        ToolDefinition.ToolDefinitionBuilder builder = ToolDefinition.builder()
                .name(tool.path("name").asText())
                .description(tool.path("description").asText(""));
        JsonNode schema = tool.get("inputSchema");
        if (schema != null && schema.isObject()) {
            builder.inputSchema(objectMapper.convertValue(schema, new TypeReference<Map<String, Object>>() {}));
        }
        return builder.build();
    }

    private String renderContent(JsonNode content) {
        if (!content.isArray()) {
            return content.isMissingNode() || content.isNull() ? "" : content.toString();
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                parts.add(block.path("text").asText());
            } else {
                parts.add(block.toString());
            }
        }
        return String.join("\n", parts);
    }
}
