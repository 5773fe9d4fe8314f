package org.javai.failover.health;

import org.javai.failover.boundary.AttemptOutcome;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-gateway health records, index-aligned with the gateway priority order.
 *
 * <p>Every attempt overwrites its gateway's record. The lock guards only the records, so
 * concurrent calls sharing one client serialize on bookkeeping and never on network I/O.
 */
public final class HealthTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final GatewayHealth[] records;
    private final Clock clock;

    public HealthTracker(List<String> gatewayUrls) {
        this(gatewayUrls, Clock.systemUTC());
    }

    public HealthTracker(List<String> gatewayUrls, Clock clock) {
        Objects.requireNonNull(gatewayUrls, "gatewayUrls must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.records = gatewayUrls.stream()
                .map(GatewayHealth::unknown)
                .toArray(GatewayHealth[]::new);
    }

    /**
     * Records the outcome of one attempt against the gateway at {@code gatewayIndex}.
     *
     * @param gatewayIndex position in the priority order
     * @param outcome what the attempt produced
     * @param elapsedMs wall-clock duration of the attempt
     * @throws IndexOutOfBoundsException if the index is not a known gateway
     */
    public void recordAttempt(int gatewayIndex, AttemptOutcome outcome, long elapsedMs) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.checkIndex(gatewayIndex, records.length);

        lock.lock();
        try {
            GatewayHealth current = records[gatewayIndex];
            records[gatewayIndex] = outcome.isSuccess()
                    ? current.succeeded(clock.instant().getEpochSecond(), elapsedMs)
                    : current.failed(outcome.describe(), elapsedMs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current record of one gateway.
     */
    public GatewayHealth health(int gatewayIndex) {
        Objects.checkIndex(gatewayIndex, records.length);
        lock.lock();
        try {
            return records[gatewayIndex];
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns all records in priority order.
     *
     * @return an unmodifiable copy, unaffected by later attempts
     */
    public List<GatewayHealth> snapshot() {
        lock.lock();
        try {
            return List.of(records);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return records.length;
    }
}
