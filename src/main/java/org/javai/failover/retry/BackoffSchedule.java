package org.javai.failover.retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * A stepped delay table plus an exclusive jitter bound.
 *
 * <p>{@link #RETRY} and {@link #FAILOVER} are the only schedules the client uses; every delay
 * constant lives here.
 *
 * @param stepsMs base delays in milliseconds; indexes past the end reuse the last step
 * @param jitterBoundMs jitter is drawn uniformly from {@code [0, jitterBoundMs)}
 */
public record BackoffSchedule(List<Long> stepsMs, int jitterBoundMs) {

    /**
     * Between attempts on the same gateway: 200, 500, 1000 ms, plus up to 49 ms.
     */
    public static final BackoffSchedule RETRY = new BackoffSchedule(List.of(200L, 500L, 1000L), 50);

    /**
     * After abandoning a gateway: 300, 1000, 2000 ms, plus up to 99 ms.
     */
    public static final BackoffSchedule FAILOVER = new BackoffSchedule(List.of(300L, 1000L, 2000L), 100);

    public BackoffSchedule {
        Objects.requireNonNull(stepsMs, "stepsMs must not be null");
        if (stepsMs.isEmpty()) {
            throw new IllegalArgumentException("stepsMs must not be empty");
        }
        if (jitterBoundMs <= 0) {
            throw new IllegalArgumentException("jitterBoundMs must be > 0, was: " + jitterBoundMs);
        }
        stepsMs = List.copyOf(stepsMs);
    }

    /**
     * Base delay for {@code index}, without jitter.
     *
     * @throws IllegalArgumentException if index is negative
     */
    public Duration baseDelayFor(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, was: " + index);
        }
        return Duration.ofMillis(stepsMs.get(Math.min(index, stepsMs.size() - 1)));
    }

    /**
     * Base delay for {@code index} plus {@code jitterMs}, which must be inside the jitter range.
     */
    public Duration delayFor(int index, int jitterMs) {
        if (jitterMs < 0 || jitterMs >= jitterBoundMs) {
            throw new IllegalArgumentException(
                    "jitter must be in [0, " + jitterBoundMs + "), was: " + jitterMs);
        }
        return baseDelayFor(index).plusMillis(jitterMs);
    }
}
