package org.javai.failover.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What to do after a failed attempt on a gateway: try the same gateway again, or leave it.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    String RATE_LIMITED = "rate limited";
    String NOT_RETRYABLE = "not retryable";
    String RETRIES_EXHAUSTED = "retries exhausted";

    /**
     * Retry the same gateway after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * Stop trying this gateway.
     */
    record GiveUp(String reason) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
