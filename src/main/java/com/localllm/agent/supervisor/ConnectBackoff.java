package com.localllm.agent.supervisor;

import java.time.Duration;
import java.time.Instant;

/** Consecutive on-demand connect failures of one provider, across connections. */
record ConnectBackoff(int failures, Instant notBefore, String lastError) {

    static ConnectBackoff after(ConnectBackoff previous, String error, Duration baseDelay, Duration maxDelay) {
        int failures = previous == null ? 1 : previous.failures() + 1;
        Duration delay = baseDelay.multipliedBy(1L << Math.min(failures - 1, 20));
        if (delay.compareTo(maxDelay) > 0) {
            delay = maxDelay;
        }
        return new ConnectBackoff(failures, Instant.now().plus(delay), error);
    }
}
