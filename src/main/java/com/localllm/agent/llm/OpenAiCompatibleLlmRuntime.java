package com.localllm.agent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.LlmUnavailableException;
import com.localllm.agent.model.Message;
import com.localllm.agent.model.ToolCall;
import com.localllm.agent.tool.ToolDefinition;
import com.localllm.agent.transport.ServerSentEvent;
import com.localllm.agent.transport.ServerSentEventReader;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streaming client for OpenAI-compatible chat completions (Ollama, OpenAI, Groq).
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                          |
 * |--------------------------|-------------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried)                    |
 * | 400 tool_use_failed      | Recover the call from failed_generation         |
 * | 400 / other 4xx          | AgentException (not retried)                    |
 * | 429, 5xx                 | LlmUnavailableException (retried)               |
 * | network error            | LlmUnavailableException (retried)               |
 */
@Slf4j
public class OpenAiCompatibleLlmRuntime implements LlmRuntime {

    // Groq sometimes emits <function=name({...})</function> or <function=name{...}></function>
    private static final Pattern GROQ_XML_TOOL_PATTERN =
            Pattern.compile("<function=(\\w+)\\(?(\\{.+?\\})\\)?(?:</function>|>)", Pattern.DOTALL);

    private static final String DONE = "[DONE]";

    private final LlmProperties props;
    private final LlmProperties.Endpoint endpoint;
    private final String providerName;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiCompatibleLlmRuntime(LlmProperties props,
                                      CloseableHttpClient httpClient,
                                      ObjectMapper objectMapper) {
        this.props = props;
        this.endpoint = props.active();
        this.providerName = props.getProvider().toLowerCase();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String modelName() {
        return endpoint.getModel();
    }

    @Override
    public LlmStream stream(List<Message> messages, List<ToolDefinition> tools) {
        HttpPost post = new HttpPost(stripTrailingSlash(endpoint.getBaseUrl()) + "/chat/completions");
        if (endpoint.getApiKey() != null && !endpoint.getApiKey().isBlank()) {
            post.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + endpoint.getApiKey());
        }
        post.setHeader(HttpHeaders.ACCEPT, "text/event-stream");
        post.setConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(props.getReadTimeout().toMillis()))
                .build());
        post.setEntity(new StringEntity(writeJson(buildRequestBody(messages, tools)), ContentType.APPLICATION_JSON));

        log.debug("Streaming {} messages to {} [model={}, tools={}]",
                messages.size(), providerName, endpoint.getModel(), tools.size());

        ClassicHttpResponse response;
        try {
            response = httpClient.executeOpen(null, post, HttpClientContext.create());
        } catch (IOException e) {
            throw new LlmUnavailableException(providerName + " unreachable: " + e.getMessage(), e);
        }

        int status = response.getCode();
        if (status >= 400) {
            String body = readAndClose(response);
            log.error("{} {} [{}]: {}", providerName, status >= 500 ? "5xx" : "4xx", status, body);
            if (status == 400 && body.contains("tool_use_failed")) {
                return new RecoveredStream(recoverFromGroqToolUseFailure(body));
            }
            throw mapError(status, body);
        }
        return new ChunkStream(post, response);
    }

    // ─── Request ────────────────────────────────────────────────────────────

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolDefinition> tools) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", endpoint.getModel());
        body.put("max_tokens", endpoint.getMaxTokens());
        body.put("temperature", endpoint.getTemperature());
        body.put("stream", true);
        body.put("messages", messages.stream().map(this::formatMessage).toList());

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
            body.put("parallel_tool_calls", props.isParallelToolCalls());
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent());
        } else if (msg.getRole() == Message.Role.assistant) {
            // an assistant turn that called tools must carry tool_calls or the results cannot be correlated
            m.put("content", msg.getContent());
            if (msg.getToolCalls() != null && !msg.getToolCalls().isEmpty()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall tc) {
        Map<String, Object> fn = new HashMap<>();
        fn.put("name", tc.getToolName());
        fn.put("arguments", writeJson(tc.getArguments() != null ? tc.getArguments() : Map.of()));

        Map<String, Object> call = new HashMap<>();
        call.put("id", tc.getId());
        call.put("type", "function");
        call.put("function", fn);
        return call;
    }

    // ─── Errors ─────────────────────────────────────────────────────────────

    private AgentException mapError(int status, String body) {
        if (status == 401) {
            return new AgentException(providerName + " API key is invalid. Check the "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (status == 429) {
            return new LlmUnavailableException(providerName + " rate limit exceeded");
        }
        if (status >= 500) {
            return new LlmUnavailableException(providerName + " server error [" + status + "]");
        }
        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            return new AgentException("Model '" + endpoint.getModel() + "' is not available on "
                    + providerName + ". Update llm." + providerName + ".model.");
        }
        return new AgentException(providerName + " client error [" + status + "]: " + body);
    }

    /**
     * Groq's tool_use_failed error carries the malformed generation in
     * "failed_generation"; the XML-ish call inside is still usable.
     */
    private List<LlmEvent> recoverFromGroqToolUseFailure(String errorBody) {
        String fallback = "I encountered a tool formatting issue. Please rephrase your request.";
        try {
            JsonNode error = objectMapper.readTree(errorBody).path("error");
            String failedGeneration = error.path("failed_generation").asText("");
            Matcher matcher = GROQ_XML_TOOL_PATTERN.matcher(failedGeneration);
            if (!matcher.find()) {
                log.warn("Could not parse tool call from failed_generation: {}", failedGeneration);
                return List.of(new LlmEvent.TextToken(fallback));
            }
            Map<String, Object> args = objectMapper.readValue(matcher.group(2), new TypeReference<>() {});
            log.info("Recovered malformed tool call [tool={}]", matcher.group(1));
            ToolCall call = ToolCall.builder()
                    .id("recovered-" + UUID.randomUUID().toString().substring(0, 8))
                    .toolName(matcher.group(1))
                    .arguments(args)
                    .build();
            return List.of(new LlmEvent.ToolCallBatch(List.of(call), false));
        } catch (JsonProcessingException e) {
            log.error("Failed to recover from tool_use_failed: {}", e.getOriginalMessage());
            return List.of(new LlmEvent.TextToken(fallback));
        }
    }

    // ─── Helpers ────────────────────────────────────────────────────────────

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AgentException("Could not serialize LLM request", e);
        }
    }

    private static String readAndClose(ClassicHttpResponse response) {
        try (response) {
            if (response.getEntity() == null) {
                return "";
            }
            try (InputStream in = response.getEntity().getContent()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ─── Streams ────────────────────────────────────────────────────────────

    /** Parses chat.completion.chunk events, accumulating tool-call deltas by index. */
    private final class ChunkStream implements LlmStream {

        private final HttpPost request;
        private final ClassicHttpResponse response;
        private final Deque<LlmEvent> ready = new ArrayDeque<>();
        private final Map<Integer, PartialCall> partialCalls = new TreeMap<>();
        private ServerSentEventReader events;
        private volatile boolean cancelled;
        private boolean finished;

        ChunkStream(HttpPost request, ClassicHttpResponse response) {
            this.request = request;
            this.response = response;
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !finished && !cancelled) {
                readChunk();
            }
            return !ready.isEmpty() && !cancelled;
        }

        @Override
        public LlmEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }

        @Override
        public void cancel() {
            cancelled = true;
            request.cancel();
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public void close() {
            finished = true;
            try {
                response.close();
            } catch (IOException e) {
                log.debug("LLM response close failed: {}", e.getMessage());
            }
        }

        private void readChunk() {
            try {
                if (events == null) {
                    if (response.getEntity() == null) {
                        finish();
                        return;
                    }
                    events = new ServerSentEventReader(response.getEntity().getContent());
                }
                ServerSentEvent event = events.next();
                if (event == null || DONE.equals(event.data().trim())) {
                    finish();
                    return;
                }
                apply(objectMapper.readTree(event.data()));
            } catch (IOException e) {
                if (cancelled) {
                    finished = true;
                    return;
                }
                close();
                throw new LlmUnavailableException(providerName + " stream interrupted: " + e.getMessage(), e);
            }
        }

        private void apply(JsonNode chunk) {
            if (chunk.has("error")) {
                close();
                throw new LlmUnavailableException(providerName + " stream error: "
                        + chunk.path("error").path("message").asText(chunk.path("error").toString()));
            }
            JsonNode choice = chunk.path("choices").path(0);
            JsonNode delta = choice.path("delta");

            String content = delta.path("content").asText("");
            if (!content.isEmpty()) {
                ready.add(new LlmEvent.TextToken(content));
            }
            for (JsonNode tc : delta.path("tool_calls")) {
                PartialCall partial = partialCalls.computeIfAbsent(tc.path("index").asInt(0), i -> new PartialCall());
                if (tc.hasNonNull("id")) {
                    partial.id = tc.get("id").asText();
                }
                JsonNode fn = tc.path("function");
                if (fn.hasNonNull("name")) {
                    partial.name.append(fn.get("name").asText());
                }
                if (fn.hasNonNull("arguments")) {
                    partial.arguments.append(fn.get("arguments").asText());
                }
            }
            String finishReason = choice.path("finish_reason").asText("");
            if (!finishReason.isEmpty()) {
                log.debug("{} finish_reason: {}", providerName, finishReason);
                flushToolCalls();
            }
        }

        private void finish() {
            flushToolCalls();
            close();
        }

        private void flushToolCalls() {
            if (partialCalls.isEmpty()) {
                return;
            }
            List<ToolCall> calls = new ArrayList<>();
            for (PartialCall partial : partialCalls.values()) {
                calls.add(partial.toToolCall());
            }
            partialCalls.clear();
            ready.add(new LlmEvent.ToolCallBatch(calls, props.isParallelToolCalls() && calls.size() > 1));
        }
    }

    private final class PartialCall {
        private String id;
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();

        ToolCall toToolCall() {
            Map<String, Object> args = Map.of();
            String argumentError = null;
            String raw = arguments.toString().trim();
            if (!raw.isEmpty()) {
                try {
                    args = objectMapper.readValue(raw, new TypeReference<>() {});
                } catch (JsonProcessingException e) {
                    log.warn("{} sent malformed arguments for tool '{}': {}", providerName, name, raw);
                    argumentError = "arguments are not valid JSON (" + e.getOriginalMessage() + ")";
                }
            }
            return ToolCall.builder()
                    .id(id != null ? id : "call-" + UUID.randomUUID().toString().substring(0, 8))
                    .toolName(name.toString())
                    .arguments(args != null ? args : Map.of())
                    .argumentError(argumentError)
                    .build();
        }
    }

    /** Pre-computed events, used when a failed request could still be salvaged. */
    private static final class RecoveredStream implements LlmStream {

        private final Deque<LlmEvent> events;
        private volatile boolean cancelled;

        RecoveredStream(List<LlmEvent> events) {
            this.events = new ArrayDeque<>(events);
        }

        @Override
        public boolean hasNext() {
            return !cancelled && !events.isEmpty();
        }

        @Override
        public LlmEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return events.poll();
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public void close() {
            events.clear();
        }
    }
}
