package com.localllm.agent.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.localllm.agent.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Correlates JSON-RPC responses arriving on a reader thread with the
 * callers waiting for them.
 */
@Slf4j
class PendingRequests {

    private final String providerId;
    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private volatile TransportException terminalFailure;

    PendingRequests(String providerId) {
        this.providerId = providerId;
    }

    CompletableFuture<JsonNode> register(long id) {
        if (terminalFailure != null) {
            throw terminalFailure;
        }
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, future);
        return future;
    }

    /** Returns false for messages that are not a response to a known request. */
    boolean complete(JsonNode message) {
        JsonNode id = message.get("id");
        if (id == null || !id.canConvertToLong() || !(message.has("result") || message.has("error"))) {
            return false;
        }
        CompletableFuture<JsonNode> future = pending.remove(id.asLong());
        if (future == null) {
            log.debug("Dropping response for unknown request [provider={}, id={}]", providerId, id);
            return false;
        }
        future.complete(message);
        return true;
    }

    JsonNode await(long id, CompletableFuture<JsonNode> future, Duration timeout, String method) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransportException(
                    method + " timed out after " + timeout.toSeconds() + "s [provider=" + providerId + "]", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(method + " interrupted [provider=" + providerId + "]", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TransportException te) {
                throw te;
            }
            throw new TransportException(method + " failed [provider=" + providerId + "]", e.getCause());
        } finally {
            pending.remove(id);
        }
    }

    void cancel(long id) {
        pending.remove(id);
    }

    /** Fails every waiter and every future registration. */
    void failAll(TransportException failure) {
        terminalFailure = failure;
        pending.values().forEach(f -> f.completeExceptionally(failure));
        pending.clear();
    }
}
