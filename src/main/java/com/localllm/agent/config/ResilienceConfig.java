package com.localllm.agent.config;

import com.localllm.agent.exception.AgentException;
import com.localllm.agent.exception.TurnCancelledException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turn-level retry and circuit breaker, configured in code.
 *
 * Breaker: count-based window the size of the failure threshold with a 100%
 * failure-rate threshold, so it opens after that many consecutive failures.
 * One trial call in half-open. Only transient failures are recorded;
 * cancellation and client errors never open the breaker.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry turnCircuitBreakerRegistry(AgentProperties properties) {
        AgentProperties.Resilience r = properties.getResilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(r.getFailureThreshold())
                .minimumNumberOfCalls(r.getFailureThreshold())
                .failureRateThreshold(100f)
                .waitDurationInOpenState(r.getCoolDown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordException(ResilienceConfig::isTransientFailure)
                .ignoreExceptions(TurnCancelledException.class)
                .build();
        log.info("Turn circuit breaker configured [threshold={}, coolDown={}]", r.getFailureThreshold(), r.getCoolDown());
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RetryConfig turnRetryConfig(AgentProperties properties) {
        AgentProperties.Resilience r = properties.getResilience();
        return RetryConfig.custom()
                .maxAttempts(r.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(r.getInitialBackoff(), r.getBackoffMultiplier()))
                .retryOnException(ResilienceConfig::isTransientFailure)
                .build();
    }

    public static boolean isTransientFailure(Throwable t) {
        if (t instanceof TurnCancelledException) {
            return false;
        }
        if (t instanceof AgentException ae) {
            return ae.isRetryable();
        }
        return false;
    }
}
