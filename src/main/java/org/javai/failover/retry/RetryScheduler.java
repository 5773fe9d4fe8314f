package org.javai.failover.retry;

import org.javai.failover.boundary.AttemptOutcome;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;

/**
 * Decides whether a failed attempt is retried on the same gateway, and how long to wait first.
 *
 * <p>Rate limiting is never retried on the same gateway. Timeouts, transport errors and
 * retryable server errors are retried until {@code maxRetriesPerGateway} retries have been made.
 */
public final class RetryScheduler {

    private final BackoffSchedule schedule;
    private final int maxRetriesPerGateway;
    private final IntUnaryOperator jitter;

    public RetryScheduler(int maxRetriesPerGateway) {
        this(maxRetriesPerGateway, bound -> ThreadLocalRandom.current().nextInt(bound));
    }

    /**
     * @param maxRetriesPerGateway retries allowed after the first attempt on a gateway
     * @param jitter given the exclusive jitter bound, returns a value in {@code [0, bound)}
     */
    public RetryScheduler(int maxRetriesPerGateway, IntUnaryOperator jitter) {
        if (maxRetriesPerGateway < 0) {
            throw new IllegalArgumentException("maxRetriesPerGateway must be >= 0, was: " + maxRetriesPerGateway);
        }
        this.schedule = BackoffSchedule.RETRY;
        this.maxRetriesPerGateway = maxRetriesPerGateway;
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
    }

    /**
     * Delay before retry number {@code retryIndex} (0-based), including jitter.
     */
    public Duration delayFor(int retryIndex) {
        return schedule.delayFor(retryIndex, jitter.applyAsInt(schedule.jitterBoundMs()));
    }

    public Duration baseDelayFor(int retryIndex) {
        return schedule.baseDelayFor(retryIndex);
    }

    /**
     * @param outcome the failed attempt
     * @param attemptOnGateway 0-based index of that attempt on its gateway
     */
    public boolean shouldRetry(AttemptOutcome outcome, int attemptOnGateway) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (attemptOnGateway < 0) {
            throw new IllegalArgumentException("attemptOnGateway must be >= 0, was: " + attemptOnGateway);
        }
        return !outcome.isSuccess()
                && attemptOnGateway < maxRetriesPerGateway
                && outcome.retryableOnSameGateway();
    }

    /**
     * Combines {@link #shouldRetry} and {@link #delayFor} into a single decision.
     */
    public RetryDecision decide(AttemptOutcome outcome, int attemptOnGateway) {
        if (shouldRetry(outcome, attemptOnGateway)) {
            return new RetryDecision.Retry(delayFor(attemptOnGateway));
        }
        if (outcome instanceof AttemptOutcome.RateLimited) {
            return new RetryDecision.GiveUp(RetryDecision.RATE_LIMITED);
        }
        if (!outcome.retryableOnSameGateway()) {
            return new RetryDecision.GiveUp(RetryDecision.NOT_RETRYABLE);
        }
        return new RetryDecision.GiveUp(RetryDecision.RETRIES_EXHAUSTED);
    }

    public int maxRetriesPerGateway() {
        return maxRetriesPerGateway;
    }
}
