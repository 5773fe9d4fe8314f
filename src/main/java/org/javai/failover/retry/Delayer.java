package org.javai.failover.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits without holding a thread. Replaced in tests to record and skip backoff delays.
 */
@FunctionalInterface
public interface Delayer {

    /**
     * Returns a future that completes once {@code delay} has elapsed.
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * Completes on the common pool's delayed executor. Zero or negative delays complete at once.
     */
    static Delayer scheduled() {
        return delay -> {
            if (delay.isZero() || delay.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> { },
                    CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        };
    }
}
