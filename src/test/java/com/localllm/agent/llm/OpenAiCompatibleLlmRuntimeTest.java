package com.localllm.agent.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.LlmUnavailableException;
import com.localllm.agent.model.Message;
import com.localllm.agent.model.ToolCall;
import com.localllm.agent.tool.ToolDefinition;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiCompatibleLlmRuntimeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private CloseableHttpClient httpClient;
    private OpenAiCompatibleLlmRuntime runtime;

    private volatile int responseStatus = 200;
    private volatile String responseBody = "";
    private volatile JsonNode lastRequest;
    private volatile String lastAuthorization;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", this::handle);
        server.start();
        httpClient = HttpClients.createDefault();

        LlmProperties props = new LlmProperties();
        props.setProvider("openai");
        props.getOpenai().setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/");
        props.getOpenai().setApiKey("sk-test");
        props.getOpenai().setModel("gpt-test");
        runtime = new OpenAiCompatibleLlmRuntime(props, httpClient, objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        httpClient.close();
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
        lastRequest = objectMapper.readTree(exchange.getRequestBody().readAllBytes());
        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type",
                responseStatus == 200 ? "text/event-stream" : "application/json");
        exchange.sendResponseHeaders(responseStatus, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String sse(String... chunks) {
        StringBuilder sb = new StringBuilder();
        for (String chunk : chunks) {
            sb.append("data: ").append(chunk).append("\n\n");
        }
        return sb.append("data: [DONE]\n\n").toString();
    }

    private List<LlmEvent> drain(LlmStream stream) {
        List<LlmEvent> events = new ArrayList<>();
        try (stream) {
            stream.forEachRemaining(events::add);
        }
        return events;
    }

    @Test
    void stream_yieldsTokensInOrder() {
        responseBody = sse(
                "{\"choices\":[{\"delta\":{\"role\":\"assistant\",\"content\":\"Hel\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                "{\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}");

        List<LlmEvent> events = drain(runtime.stream(
                List.of(Message.system("be brief"), Message.user("hi")), List.of()));

        assertThat(events).containsExactly(new LlmEvent.TextToken("Hel"), new LlmEvent.TextToken("lo"));
        assertThat(lastAuthorization).isEqualTo("Bearer sk-test");
        assertThat(lastRequest.path("model").asText()).isEqualTo("gpt-test");
        assertThat(lastRequest.path("stream").asBoolean()).isTrue();
        assertThat(lastRequest.has("tools")).isFalse();
        assertThat(lastRequest.path("messages").path(1).path("role").asText()).isEqualTo("user");
    }

    @Test
    void stream_accumulatesToolCallDeltasByIndex() {
        responseBody = sse(
                "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"mssql__query\",\"arguments\":\"\"}}]}}]}",
                "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{\\\"sql\\\":\"}}]}}]}",
                "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"\\\"select 1\\\"}\"}}]}}]}",
                "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":1,\"id\":\"call_2\",\"function\":{\"name\":\"docs__search\",\"arguments\":\"{}\"}}]}}]}",
                "{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}");
        ToolDefinition query = ToolDefinition.builder().name("mssql__query").description("Run SQL").build();

        List<LlmEvent> events = drain(runtime.stream(List.of(Message.user("count rows")), List.of(query)));

        assertThat(events).hasSize(1);
        LlmEvent.ToolCallBatch batch = (LlmEvent.ToolCallBatch) events.get(0);
        assertThat(batch.independent()).isTrue();
        assertThat(batch.calls()).extracting(ToolCall::getId).containsExactly("call_1", "call_2");
        assertThat(batch.calls().get(0).getToolName()).isEqualTo("mssql__query");
        assertThat(batch.calls().get(0).getArguments()).isEqualTo(Map.of("sql", "select 1"));
        assertThat(batch.calls().get(1).getArguments()).isEmpty();

        assertThat(lastRequest.path("tools").path(0).path("function").path("name").asText())
                .isEqualTo("mssql__query");
        assertThat(lastRequest.path("tool_choice").asText()).isEqualTo("auto");
    }

    @Test
    void stream_toolCallsWithoutFinishReason_flushedAtEnd() {
        responseBody = sse(
                "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_9\",\"function\":{\"name\":\"echo\",\"arguments\":\"{\\\"text\\\":\\\"x\\\"}\"}}]}}]}");

        List<LlmEvent> events = drain(runtime.stream(List.of(Message.user("echo x")), List.of()));

        assertThat(events).singleElement().isInstanceOfSatisfying(LlmEvent.ToolCallBatch.class, batch -> {
            assertThat(batch.independent()).isFalse();
            assertThat(batch.calls().get(0).getArguments()).containsEntry("text", "x");
        });
    }

    @Test
    void stream_malformedToolArguments_yieldCallMarkedWithArgumentError() {
        responseBody = sse(
                "{\"choices\":[{\"delta\":{\"content\":\"Let me check\"}}]}",
                "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_1\",\"function\":{\"name\":\"query\",\"arguments\":\"{\\\"sql\\\": select\"}}]}}]}",
                "{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}");

        List<LlmEvent> events = drain(runtime.stream(List.of(Message.user("count rows")), List.of()));

        assertThat(events).hasSize(2);
        assertThat(events.get(0)).isEqualTo(new LlmEvent.TextToken("Let me check"));
        ToolCall call = ((LlmEvent.ToolCallBatch) events.get(1)).calls().get(0);
        assertThat(call.getToolName()).isEqualTo("query");
        assertThat(call.getArguments()).isEmpty();
        assertThat(call.getArgumentError()).startsWith("arguments are not valid JSON");
    }

    @Test
    void stream_invalidApiKey_notRetryable() {
        responseStatus = 401;
        responseBody = "{\"error\":{\"code\":\"invalid_api_key\"}}";

        assertThatThrownBy(() -> runtime.stream(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(AgentException.class)
                .isNotInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("OPENAI_API_KEY");
    }

    @Test
    void stream_rateLimited_retryable() {
        responseStatus = 429;
        responseBody = "{\"error\":{\"message\":\"slow down\"}}";

        assertThatThrownBy(() -> runtime.stream(List.of(Message.user("hi")), List.of()))
                .isInstanceOfSatisfying(LlmUnavailableException.class,
                        e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void stream_serverError_retryable() {
        responseStatus = 503;
        responseBody = "{}";

        assertThatThrownBy(() -> runtime.stream(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("503");
    }

    @Test
    void stream_unreachableEndpoint_retryable() {
        LlmProperties props = new LlmProperties();
        props.getOllama().setBaseUrl("http://127.0.0.1:1/v1");
        runtime = new OpenAiCompatibleLlmRuntime(props, httpClient, objectMapper);

        assertThatThrownBy(() -> runtime.stream(List.of(Message.user("hi")), List.of()))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    void stream_errorChunkMidStream_raisesUnavailable() {
        responseBody = sse(
                "{\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}",
                "{\"error\":{\"message\":\"overloaded\"}}");

        LlmStream stream = runtime.stream(List.of(Message.user("hi")), List.of());

        assertThat(stream.next()).isEqualTo(new LlmEvent.TextToken("partial"));
        assertThatThrownBy(stream::hasNext)
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("overloaded");
    }

    @Test
    void stream_groqToolUseFailed_recoversCall() {
        responseStatus = 400;
        responseBody = "{\"error\":{\"code\":\"tool_use_failed\","
                + "\"failed_generation\":\"<function=docs__search{\\\"query\\\": \\\"retry\\\"}></function>\"}}";

        List<LlmEvent> events = drain(runtime.stream(List.of(Message.user("search docs")), List.of()));

        assertThat(events).singleElement().isInstanceOfSatisfying(LlmEvent.ToolCallBatch.class, batch -> {
            assertThat(batch.calls().get(0).getToolName()).isEqualTo("docs__search");
            assertThat(batch.calls().get(0).getArguments()).containsEntry("query", "retry");
            assertThat(batch.calls().get(0).getId()).startsWith("recovered-");
        });
    }

    @Test
    void stream_groqToolUseFailedUnparseable_fallsBackToText() {
        responseStatus = 400;
        responseBody = "{\"error\":{\"code\":\"tool_use_failed\",\"failed_generation\":\"garbage\"}}";

        List<LlmEvent> events = drain(runtime.stream(List.of(Message.user("search docs")), List.of()));

        assertThat(events).singleElement().isInstanceOf(LlmEvent.TextToken.class);
    }

    @Test
    void cancel_stopsIteration() {
        responseBody = sse(
                "{\"choices\":[{\"delta\":{\"content\":\"a\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"b\"}}]}");

        LlmStream stream = runtime.stream(List.of(Message.user("hi")), List.of());
        assertThat(stream.next()).isEqualTo(new LlmEvent.TextToken("a"));
        stream.cancel();

        assertThat(stream.isCancelled()).isTrue();
        assertThat(stream.hasNext()).isFalse();
        stream.close();
    }
}
