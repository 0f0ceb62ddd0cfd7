package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.localllm.agent.exception.TransportException;
import com.localllm.agent.provider.EnvironmentResolver;
import com.localllm.agent.provider.ProviderConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;

import java.io.IOException;
import java.time.Duration;

/**
 * MCP over HTTP POST. Each request carries one JSON-RPC message; the
 * server answers with either a JSON body or an event stream whose
 * message events carry the response.
 */
@Slf4j
public class StreamableHttpTransport extends AbstractHttpMcpTransport {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private volatile String sessionId;

    public StreamableHttpTransport(ProviderConfig config, ObjectMapper objectMapper,
                                   CloseableHttpClient httpClient, EnvironmentResolver resolver) {
        super(config, objectMapper, httpClient, resolver);
    }

    @Override
    protected void open() {
        log.debug("Opening streamable_http provider [provider={}, url={}]", providerId(), url);
    }

    @Override
    protected JsonNode sendRequest(long id, ObjectNode request, Duration timeout) {
        return execute(post(request), timeout, response -> {
            captureSession(response);
            requireSuccess(response);
            HttpEntity entity = response.getEntity();
            if (isEventStream(entity)) {
                return readFromEventStream(entity, id);
            }
            String body = readBody(entity);
            if (body.isBlank()) {
                throw new TransportException("Empty response body from provider " + providerId());
            }
            return parse(body);
        });
    }

    @Override
    protected void sendNotification(ObjectNode notification) {
        execute(post(notification), callTimeout(), response -> {
            captureSession(response);
            requireSuccess(response);
            return null;
        });
    }

    @Override
    protected void doClose() {
        String session = sessionId;
        if (session == null) {
            return;
        }
        HttpDelete delete = new HttpDelete(url);
        headers.forEach(delete::setHeader);
        delete.setHeader(McpProtocol.SESSION_HEADER, session);
        try {
            execute(delete, CLOSE_TIMEOUT, response -> null);
        } catch (TransportException e) {
            log.debug("Session DELETE failed [provider={}]: {}", providerId(), e.getMessage());
        }
    }

    String sessionId() {
        return sessionId;
    }

    private HttpPost post(JsonNode message) {
        HttpPost post = jsonPost(url, message);
        String session = sessionId;
        if (session != null) {
            post.setHeader(McpProtocol.SESSION_HEADER, session);
        }
        return post;
    }

    private void captureSession(ClassicHttpResponse response) {
        Header header = response.getFirstHeader(McpProtocol.SESSION_HEADER);
        if (header != null && !header.getValue().isBlank()) {
            sessionId = header.getValue();
        }
    }

    private JsonNode readFromEventStream(HttpEntity entity, long id) throws IOException {
        try (ServerSentEventReader events = new ServerSentEventReader(entity.getContent())) {
            ServerSentEvent event;
            while ((event = events.next()) != null) {
                if (!ServerSentEvent.DEFAULT_EVENT.equals(event.event()) || event.data().isBlank()) {
                    continue;
                }
                JsonNode message = parse(event.data());
                if (message.path("id").asLong(-1) == id) {
                    return message;
                }
                log.debug("Skipping interleaved message [provider={}, method={}]",
                        providerId(), message.path("method").asText("-"));
            }
        }
        throw new TransportException("Event stream ended before response " + id + " [provider=" + providerId() + "]");
    }
}
