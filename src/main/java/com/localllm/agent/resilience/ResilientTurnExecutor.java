package com.localllm.agent.resilience;

import com.localllm.agent.config.ResilienceConfig;
import com.localllm.agent.core.TurnState;
import com.localllm.agent.exception.CircuitOpenException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a whole turn under retry and a per-conversation circuit breaker.
 *
 * Design decisions:
 * - Retry wraps the breaker, so every attempt is recorded and an open breaker
 *   stops the remaining attempts at once.
 * - A turn that already streamed anything to the client is never retried; the
 *   client would see output twice.
 * - Cancellation is neither retried nor counted as a failure.
 * - One breaker per conversation ("turn-{conversationId}"), dropped with the session.
 */
@Component
@Slf4j
public class ResilientTurnExecutor {

    private static final String PREFIX = "turn-";

    private final CircuitBreakerRegistry breakers;
    private final RetryConfig retryConfig;

    public ResilientTurnExecutor(CircuitBreakerRegistry breakers, RetryConfig retryConfig) {
        this.breakers = breakers;
        this.retryConfig = retryConfig;
    }

    public <T> T execute(TurnState state, Supplier<T> turn) {
        String name = PREFIX + state.conversationId();
        CircuitBreaker breaker = breakers.circuitBreaker(name);
        Retry retry = Retry.of(name, RetryConfig.from(retryConfig)
                .retryOnException(e -> ResilienceConfig.isTransientFailure(e)
                        && !state.isOutputEmitted()
                        && !state.isCancelled())
                .build());
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying turn [conversationId={}, attempt={}, wait={}ms]: {}",
                        state.conversationId(), event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));

        Supplier<T> guarded = Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(breaker, turn));
        try {
            return guarded.get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open, turn rejected [conversationId={}, state={}]", state.conversationId(), breaker.getState());
            throw new CircuitOpenException("conversation " + state.conversationId(), e);
        }
    }

    public CircuitBreaker.State breakerState(String conversationId) {
        return breakers.find(PREFIX + conversationId)
                .map(CircuitBreaker::getState)
                .orElse(CircuitBreaker.State.CLOSED);
    }

    public void removeBreaker(String conversationId) {
        breakers.remove(PREFIX + conversationId);
    }
}
