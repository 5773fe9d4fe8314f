package org.javai.failover.retry;

import org.javai.failover.GatewayConfig;
import org.javai.failover.GatewayError;
import org.javai.failover.GatewayRequest;
import org.javai.failover.GatewayResponse;
import org.javai.failover.Outcome;
import org.javai.failover.boundary.AttemptOutcome;
import org.javai.failover.boundary.RequestExecutor;
import org.javai.failover.health.HealthTracker;
import org.javai.failover.ops.GatewayAttempt;
import org.javai.failover.ops.GatewayReporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one logical request across the gateways in priority order.
 *
 * <p>Each gateway gets an initial attempt plus up to {@code maxRetriesPerGateway} retries, with
 * {@link RetryScheduler} backoff in between. A gateway that is exhausted, rate limited or answers
 * with a non-retryable error is abandoned for the next one after {@link FailoverScheduler}
 * backoff. The first success is returned; if every gateway is exhausted the result is
 * {@link GatewayError.AllGatewaysFailed} carrying the exact number of HTTP calls made.
 *
 * <p>Every call starts at the primary regardless of earlier results. Health is recorded after
 * every attempt but never consulted for routing.
 *
 * <p>All waiting goes through the {@link Delayer}, so no thread is held during backoff.
 * The returned future completes exceptionally only when an executor, delayer or reporter has a
 * defect.
 */
public final class FailoverOrchestrator {

    private final List<String> gateways;
    private final RequestExecutor executor;
    private final HealthTracker healthTracker;
    private final RetryScheduler retryScheduler;
    private final FailoverScheduler failoverScheduler;
    private final Delayer delayer;
    private final GatewayReporter reporter;

    public FailoverOrchestrator(
            GatewayConfig config,
            RequestExecutor executor,
            HealthTracker healthTracker,
            RetryScheduler retryScheduler,
            FailoverScheduler failoverScheduler,
            Delayer delayer,
            GatewayReporter reporter
    ) {
        this.gateways = Objects.requireNonNull(config, "config must not be null").priorityOrder();
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker must not be null");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "retryScheduler must not be null");
        this.failoverScheduler = Objects.requireNonNull(failoverScheduler, "failoverScheduler must not be null");
        this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        if (healthTracker.size() != gateways.size()) {
            throw new IllegalArgumentException("healthTracker must track " + gateways.size()
                    + " gateways, tracks " + healthTracker.size());
        }
    }

    /**
     * Executes {@code request}, starting at the primary gateway.
     *
     * <p>Completing or cancelling the returned future, for example through
     * {@link CompletableFuture#orTimeout}, stops the call: no further attempt or backoff is
     * started, and an attempt still in flight is neither recorded in health nor reported.
     *
     * @return the first successful response, or {@code AllGatewaysFailed}
     */
    public CompletableFuture<Outcome<GatewayResponse>> execute(GatewayRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        CompletableFuture<Outcome<GatewayResponse>> result = new CompletableFuture<>();
        attempt(request, result, new AtomicInteger(), 0, 0);
        return result;
    }

    private void attempt(GatewayRequest request, CompletableFuture<Outcome<GatewayResponse>> result,
                         AtomicInteger callCount, int gatewayIndex, int attemptOnGateway) {
        if (result.isDone()) {
            return;
        }
        String url = gateways.get(gatewayIndex);
        long started = System.nanoTime();

        CompletableFuture<AttemptOutcome> pending;
        try {
            pending = executor.execute(url, request);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        pending.whenComplete((outcome, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            try {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                onOutcome(request, result, callCount, gatewayIndex, attemptOnGateway, outcome, elapsedMs);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private void onOutcome(GatewayRequest request, CompletableFuture<Outcome<GatewayResponse>> result,
                           AtomicInteger callCount, int gatewayIndex, int attemptOnGateway,
                           AttemptOutcome outcome, long elapsedMs) {
        healthTracker.recordAttempt(gatewayIndex, outcome, elapsedMs);

        GatewayAttempt attempt = new GatewayAttempt(
                gatewayIndex,
                gateways.get(gatewayIndex),
                GatewayConfig.gatewayLabel(gatewayIndex),
                attemptOnGateway,
                callCount.incrementAndGet(),
                outcome,
                elapsedMs);
        reporter.reportAttempt(attempt);

        if (outcome instanceof AttemptOutcome.Success success) {
            result.complete(Outcome.ok(success.response()));
            return;
        }

        RetryDecision decision = retryScheduler.decide(outcome, attemptOnGateway);
        if (decision instanceof RetryDecision.Retry retry) {
            reporter.reportRetry(attempt, retry.delay());
            after(retry.delay(), result,
                    () -> attempt(request, result, callCount, gatewayIndex, attemptOnGateway + 1));
            return;
        }
        failover(request, result, callCount, attempt);
    }

    private void failover(GatewayRequest request, CompletableFuture<Outcome<GatewayResponse>> result,
                          AtomicInteger callCount, GatewayAttempt last) {
        int abandoned = last.gatewayIndex();
        if (!failoverScheduler.shouldFailover(abandoned)) {
            GatewayError.AllGatewaysFailed error = new GatewayError.AllGatewaysFailed(callCount.get());
            reporter.reportExhausted(error, gateways.size());
            result.complete(Outcome.fail(error));
            return;
        }

        int next = abandoned + 1;
        Duration delay = failoverScheduler.delayFor(abandoned);
        reporter.reportFailover(last, gateways.get(next), delay);
        after(delay, result, () -> attempt(request, result, callCount, next, 0));
    }

    private void after(Duration delay, CompletableFuture<Outcome<GatewayResponse>> result, Runnable step) {
        delayer.delay(delay).whenComplete((ignored, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error != null) {
                result.completeExceptionally(unwrap(error));
                return;
            }
            step.run();
        });
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
