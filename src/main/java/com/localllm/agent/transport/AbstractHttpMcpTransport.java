package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.localllm.agent.exception.TransportException;
import com.localllm.agent.provider.EnvironmentResolver;
import com.localllm.agent.provider.ProviderConfig;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared plumbing for the two HTTP transport kinds: resolved url and
 * headers, and request execution bounded by a hard deadline.
 *
 * The client's response timeout is a per-read limit; a slow event stream
 * could exceed the per-call timeout while never going quiet, so each
 * request is also cancelled when its deadline passes.
 */
abstract class AbstractHttpMcpTransport extends AbstractMcpTransport {

    @FunctionalInterface
    protected interface ResponseReader<T> {
        T read(ClassicHttpResponse response) throws IOException;
    }

    protected final CloseableHttpClient httpClient;
    protected final String url;
    protected final Map<String, String> headers;

    protected AbstractHttpMcpTransport(ProviderConfig config, ObjectMapper objectMapper,
                                       CloseableHttpClient httpClient, EnvironmentResolver resolver) {
        super(config, objectMapper);
        this.httpClient = httpClient;
        this.url = resolver.resolve(config.getUrl());
        this.headers = resolver.resolveAll(config.getHeaders());
    }

    @Override
    public boolean supportsConcurrentCalls() {
        return true;
    }

    protected HttpPost jsonPost(String target, JsonNode message) {
        HttpPost post = new HttpPost(target);
        headers.forEach(post::setHeader);
        post.setHeader(HttpHeaders.ACCEPT, "application/json, text/event-stream");
        post.setEntity(new StringEntity(serialize(message), ContentType.APPLICATION_JSON));
        return post;
    }

    protected <T> T execute(HttpUriRequestBase request, Duration timeout, ResponseReader<T> reader) {
        request.setConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
                .build());

        AtomicBoolean expired = new AtomicBoolean();
        CompletableFuture<Void> deadline = CompletableFuture.runAsync(() -> {
            expired.set(true);
            request.cancel();
        }, CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));

        try (ClassicHttpResponse response = httpClient.executeOpen(null, request, HttpClientContext.create())) {
            return reader.read(response);
        } catch (IOException e) {
            if (expired.get()) {
                throw new TransportException(request.getMethod() + " timed out after " + timeout.toSeconds()
                        + "s [provider=" + providerId() + "]", e);
            }
            throw new TransportException(request.getMethod() + " " + request.getRequestUri()
                    + " failed [provider=" + providerId() + "]: " + e.getMessage(), e);
        } finally {
            deadline.cancel(false);
        }
    }

    protected void requireSuccess(ClassicHttpResponse response) {
        int code = response.getCode();
        if (code < 200 || code >= 300) {
            throw new TransportException("HTTP " + code + " from provider " + providerId());
        }
    }

    protected static String readBody(HttpEntity entity) throws IOException {
        if (entity == null) {
            return "";
        }
        try (InputStream in = entity.getContent()) {
            return new String(in.readAllBytes(), contentCharset(entity));
        }
    }

    protected static boolean isEventStream(HttpEntity entity) {
        return entity != null && entity.getContentType() != null
                && entity.getContentType().toLowerCase().startsWith("text/event-stream");
    }

    private static java.nio.charset.Charset contentCharset(HttpEntity entity) {
        ContentType type = entity.getContentType() != null ? ContentType.parse(entity.getContentType()) : null;
        return type != null && type.getCharset() != null ? type.getCharset() : java.nio.charset.StandardCharsets.UTF_8;
    }
}
