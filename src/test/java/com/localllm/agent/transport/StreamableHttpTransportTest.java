package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.localllm.agent.exception.ToolInvocationException;
import com.localllm.agent.exception.TransportException;
import com.localllm.agent.provider.EnvironmentResolver;
import com.localllm.agent.provider.ProviderConfig;
import com.localllm.agent.provider.TransportKind;
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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamableHttpTransportTest {

    private static final String SESSION = "session-42";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> sessionHeaders = new CopyOnWriteArrayList<>();
    private final List<String> authorizationHeaders = new CopyOnWriteArrayList<>();
    private final List<String> deletedSessions = new CopyOnWriteArrayList<>();
    private volatile boolean eventStreamResponses;

    private HttpServer server;
    private ExecutorService serverThreads;
    private CloseableHttpClient httpClient;
    private StreamableHttpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        serverThreads = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/mcp", this::handle);
        server.createContext("/broken", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.setExecutor(serverThreads);
        server.start();
        httpClient = HttpClients.createDefault();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (transport != null) {
            transport.close();
        }
        httpClient.close();
        server.stop(0);
        serverThreads.shutdownNow();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String session = exchange.getRequestHeaders().getFirst(McpProtocol.SESSION_HEADER);
            authorizationHeaders.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            if ("DELETE".equals(exchange.getRequestMethod())) {
                deletedSessions.add(session);
                exchange.sendResponseHeaders(200, -1);
                return;
            }
            sessionHeaders.add(session != null ? session : "");
            JsonNode request = objectMapper.readTree(exchange.getRequestBody());
            ObjectNode response = FakeMcpServer.handle(request);
            if (response == null) {
                exchange.sendResponseHeaders(202, -1);
                return;
            }
            if ("initialize".equals(request.path("method").asText())) {
                exchange.getResponseHeaders().set(McpProtocol.SESSION_HEADER, SESSION);
            }
            String json = objectMapper.writeValueAsString(response);
            byte[] body;
            if (eventStreamResponses) {
                exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
                body = (": keep-alive\n\n"
                        + "event: message\ndata: {\"jsonrpc\":\"2.0\",\"method\":\"notifications/progress\",\"params\":{}}\n\n"
                        + "event: message\ndata: " + json + "\n\n").getBytes(StandardCharsets.UTF_8);
            } else {
                exchange.getResponseHeaders().set("Content-Type", "application/json");
                body = json.getBytes(StandardCharsets.UTF_8);
            }
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        } finally {
            exchange.close();
        }
    }

    private ProviderConfig.ProviderConfigBuilder config(String path) {
        return ProviderConfig.builder()
                .id("docs")
                .transport(TransportKind.STREAMABLE_HTTP)
                .url("http://127.0.0.1:${DOCS_PORT}" + path)
                .headers(Map.of("Authorization", "Bearer ${API_KEY}"));
    }

    private StreamableHttpTransport transport(ProviderConfig config) {
        EnvironmentResolver resolver = new EnvironmentResolver(Map.of(
                "API_KEY", "secret123",
                "DOCS_PORT", String.valueOf(server.getAddress().getPort()))::get);
        transport = new StreamableHttpTransport(config, objectMapper, httpClient, resolver);
        return transport;
    }

    @Test
    void connect_resolvesHeaderPlaceholdersAtConnectTime() {
        transport(config("/mcp").build()).connect();

        assertThat(authorizationHeaders).isNotEmpty().allMatch("Bearer secret123"::equals);
    }

    @Test
    void connect_capturesSessionIdAndEchoesItOnLaterRequests() {
        StreamableHttpTransport t = transport(config("/mcp").build());

        t.connect();
        t.listTools();

        assertThat(t.sessionId()).isEqualTo(SESSION);
        assertThat(sessionHeaders.get(0)).isEmpty();
        assertThat(sessionHeaders.subList(1, sessionHeaders.size())).allMatch(SESSION::equals);
    }

    @Test
    void listTools_pagedJsonResponses_collectsEveryPage() {
        StreamableHttpTransport t = transport(config("/mcp").build());
        t.connect();

        List<ToolDefinition> tools = t.listTools();

        assertThat(tools).extracting(ToolDefinition::getName).contains("echo", "broken", "slow");
        assertThat(tools.get(0).getInputSchema()).containsEntry("type", "object");
    }

    @Test
    void callTool_eventStreamResponse_skipsInterleavedMessages() {
        StreamableHttpTransport t = transport(config("/mcp").build());
        t.connect();
        eventStreamResponses = true;

        ToolResult result = t.callTool("echo", Map.of("text", "streamed"));

        assertThat(result).isEqualTo(ToolResult.success("streamed"));
    }

    @Test
    void callTool_protocolError_throwsToolInvocationException() {
        StreamableHttpTransport t = transport(config("/mcp").build());
        t.connect();

        assertThatThrownBy(() -> t.callTool("broken", Map.of()))
                .isInstanceOf(ToolInvocationException.class);
    }

    @Test
    void callTool_toolLevelError_returnsErrorResult() {
        StreamableHttpTransport t = transport(config("/mcp").build());
        t.connect();

        assertThat(t.callTool("fail", Map.of()).error()).isTrue();
    }

    @Test
    void callTool_slowServer_failsAfterCallTimeout() {
        StreamableHttpTransport t = transport(config("/mcp").timeoutSeconds(1).build());
        t.connect();

        assertThatThrownBy(() -> t.callTool("slow", Map.of("ms", 4000)))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void connect_serverError_throwsTransportException() {
        StreamableHttpTransport t = transport(config("/broken").build());

        assertThatThrownBy(t::connect)
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void close_sendsSessionDelete() {
        StreamableHttpTransport t = transport(config("/mcp").build());
        t.connect();

        t.close();

        assertThat(deletedSessions).containsExactly(SESSION);
    }
}
