package org.javai.failover.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;

/**
 * Backoff between abandoning one gateway and trying the next.
 */
public final class FailoverScheduler {

    private final BackoffSchedule schedule;
    private final int gatewayCount;
    private final IntUnaryOperator jitter;

    public FailoverScheduler(int gatewayCount) {
        this(gatewayCount, bound -> ThreadLocalRandom.current().nextInt(bound));
    }

    public FailoverScheduler(int gatewayCount, IntUnaryOperator jitter) {
        if (gatewayCount <= 0) {
            throw new IllegalArgumentException("gatewayCount must be > 0, was: " + gatewayCount);
        }
        this.schedule = BackoffSchedule.FAILOVER;
        this.gatewayCount = gatewayCount;
        this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
    }

    /**
     * Delay after abandoning the gateway at {@code abandonedIndex}, including jitter.
     */
    public Duration delayFor(int abandonedIndex) {
        return schedule.delayFor(abandonedIndex, jitter.applyAsInt(schedule.jitterBoundMs()));
    }

    public Duration baseDelayFor(int abandonedIndex) {
        return schedule.baseDelayFor(abandonedIndex);
    }

    /**
     * True while a gateway after {@code gatewayIndex} remains.
     */
    public boolean shouldFailover(int gatewayIndex) {
        if (gatewayIndex < 0) {
            throw new IllegalArgumentException("gatewayIndex must be >= 0, was: " + gatewayIndex);
        }
        return gatewayIndex < gatewayCount - 1;
    }
}
