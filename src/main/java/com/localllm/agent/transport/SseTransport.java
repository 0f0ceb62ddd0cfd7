package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.localllm.agent.exception.TransportException;
import com.localllm.agent.provider.EnvironmentResolver;
import com.localllm.agent.provider.ProviderConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * MCP over the legacy server-push model: a long-lived GET event stream
 * delivers an {@code endpoint} event, requests are POSTed there and their
 * responses come back as {@code message} events on the stream.
 */
@Slf4j
public class SseTransport extends AbstractHttpMcpTransport {

    static final String ENDPOINT_EVENT = "endpoint";

    private final PendingRequests pending;
    private final CompletableFuture<URI> endpoint = new CompletableFuture<>();

    private HttpGet streamRequest;
    private ClassicHttpResponse streamResponse;

    public SseTransport(ProviderConfig config, ObjectMapper objectMapper,
                        CloseableHttpClient httpClient, EnvironmentResolver resolver) {
        super(config, objectMapper, httpClient, resolver);
        this.pending = new PendingRequests(config.getId());
    }

    @Override
    protected void open() {
        streamRequest = new HttpGet(url);
        headers.forEach(streamRequest::setHeader);
        streamRequest.setHeader(HttpHeaders.ACCEPT, "text/event-stream");
        streamRequest.setConfig(RequestConfig.custom().setResponseTimeout(Timeout.DISABLED).build());

        ServerSentEventReader events;
        try {
            streamResponse = httpClient.executeOpen(null, streamRequest, HttpClientContext.create());
            requireSuccess(streamResponse);
            if (streamResponse.getEntity() == null) {
                throw new TransportException("Event stream has no body [provider=" + providerId() + "]");
            }
            events = new ServerSentEventReader(streamResponse.getEntity().getContent());
        } catch (IOException e) {
            throw new TransportException("Could not open event stream " + url + " [provider=" + providerId() + "]", e);
        }

        Thread reader = new Thread(() -> readEvents(events), "mcp-sse-" + providerId());
        reader.setDaemon(true);
        reader.start();

        Duration timeout = callTimeout();
        try {
            URI target = endpoint.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("SSE endpoint received [provider={}, endpoint={}]", providerId(), target);
        } catch (TimeoutException e) {
            throw new TransportException("No endpoint event within " + timeout.toSeconds() + "s [provider=" + providerId() + "]", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted waiting for endpoint [provider=" + providerId() + "]", e);
        } catch (ExecutionException e) {
            throw new TransportException("Event stream failed before endpoint [provider=" + providerId() + "]", e.getCause());
        }
    }

    @Override
    protected JsonNode sendRequest(long id, ObjectNode request, Duration timeout) {
        CompletableFuture<JsonNode> future = pending.register(id);
        try {
            execute(jsonPost(endpoint.join().toString(), request), timeout, response -> {
                requireSuccess(response);
                return null;
            });
        } catch (TransportException e) {
            pending.cancel(id);
            throw e;
        }
        return pending.await(id, future, timeout, request.path("method").asText());
    }

    @Override
    protected void sendNotification(ObjectNode notification) {
        execute(jsonPost(endpoint.join().toString(), notification), callTimeout(), response -> {
            requireSuccess(response);
            return null;
        });
    }

    @Override
    protected void doClose() {
        pending.failAll(new TransportException("Transport closed [provider=" + providerId() + "]"));
        endpoint.completeExceptionally(new TransportException("Transport closed"));
        if (streamRequest != null) {
            streamRequest.cancel();
        }
        if (streamResponse != null) {
            try {
                streamResponse.close();
            } catch (IOException e) {
                log.debug("Event stream close failed [provider={}]: {}", providerId(), e.getMessage());
            }
        }
    }

    private void readEvents(ServerSentEventReader events) {
        try (events) {
            ServerSentEvent event;
            while ((event = events.next()) != null) {
                if (ENDPOINT_EVENT.equals(event.event())) {
                    endpoint.complete(URI.create(url).resolve(event.data().trim()));
                } else if (ServerSentEvent.DEFAULT_EVENT.equals(event.event()) && !event.data().isBlank()) {
                    dispatch(event.data());
                }
            }
        } catch (IOException e) {
            if (!closed) {
                log.warn("Event stream read failed [provider={}]: {}", providerId(), e.getMessage());
            }
        }
        if (!closed) {
            log.warn("Event stream ended [provider={}]", providerId());
        }
        TransportException ended = new TransportException("Event stream closed [provider=" + providerId() + "]");
        endpoint.completeExceptionally(ended);
        pending.failAll(ended);
    }

    private void dispatch(String data) {
        try {
            JsonNode message = parse(data);
            if (!pending.complete(message)) {
                log.debug("SSE message ignored [provider={}, method={}]", providerId(), message.path("method").asText("-"));
            }
        } catch (TransportException e) {
            log.debug("Ignoring malformed SSE message [provider={}]: {}", providerId(), e.getMessage());
        }
    }
}
