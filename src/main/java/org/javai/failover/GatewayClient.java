package org.javai.failover;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.failover.boundary.HttpRequestExecutor;
import org.javai.failover.boundary.RequestExecutor;
import org.javai.failover.health.GatewayHealth;
import org.javai.failover.health.HealthTracker;
import org.javai.failover.ops.CompositeGatewayReporter;
import org.javai.failover.ops.GatewayReporter;
import org.javai.failover.retry.Delayer;
import org.javai.failover.retry.FailoverOrchestrator;
import org.javai.failover.retry.FailoverScheduler;
import org.javai.failover.retry.RetryScheduler;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;

/**
 * Entry point for calling the gateways with retry and failover.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GatewayClient client = GatewayClient.builder()
 *     .reporter(CompositeGatewayReporter.of(new Log4jGatewayReporter(), new GatewayLogFileReporter()))
 *     .build();
 *
 * Outcome<GatewayResponse> result = client.fetchWithFailover(
 *     GatewayRequest.of("claim_search", params));
 *
 * JsonNode data = result.getOrThrow().data();
 * }</pre>
 *
 * <p>A client is safe to share between threads; each call is independent and always starts at
 * the primary gateway. Health records are shared and reflect the most recent attempt per gateway.
 */
public final class GatewayClient {

    private final GatewayConfig config;
    private final HealthTracker healthTracker;
    private final FailoverOrchestrator orchestrator;

    private GatewayClient(Builder builder) {
        this.config = builder.config;
        this.healthTracker = new HealthTracker(config.priorityOrder(), builder.clock);
        RequestExecutor executor = builder.executor != null
                ? builder.executor
                : new HttpRequestExecutor(builder.objectMapper);
        this.orchestrator = new FailoverOrchestrator(
                config,
                executor,
                healthTracker,
                new RetryScheduler(config.maxRetriesPerGateway(), builder.jitter),
                new FailoverScheduler(config.gatewayCount(), builder.jitter),
                builder.delayer,
                CompositeGatewayReporter.of(builder.reporter));
    }

    /**
     * A client for the production gateways with no reporting.
     */
    public static GatewayClient create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Executes the request, blocking until it succeeds or every gateway is exhausted.
     *
     * @param request the call to make
     * @return the response, or the error describing why no gateway could serve it
     */
    public Outcome<GatewayResponse> fetchWithFailover(GatewayRequest request) {
        try {
            return fetchWithFailoverAsync(request).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Executes the request without blocking the calling thread.
     *
     * <p>There is no overall deadline; apply {@link CompletableFuture#orTimeout} to bound the call.
     */
    public CompletableFuture<Outcome<GatewayResponse>> fetchWithFailoverAsync(GatewayRequest request) {
        return orchestrator.execute(request);
    }

    /**
     * Current health of each gateway, in priority order.
     */
    public List<GatewayHealth> healthStats() {
        return healthTracker.snapshot();
    }

    public GatewayConfig gatewayConfig() {
        return config;
    }

    /**
     * The configured primary gateway. See {@link GatewayConfig#currentGateway()}.
     */
    public String currentGateway() {
        return config.currentGateway();
    }

    public List<String> priorityOrder() {
        return config.priorityOrder();
    }

    /**
     * Builder for a {@link GatewayClient}. Everything is optional.
     */
    public static final class Builder {
        private GatewayConfig config = GatewayConfig.defaults();
        private RequestExecutor executor;
        private GatewayReporter reporter = GatewayReporter.noOp();
        private Delayer delayer = Delayer.scheduled();
        private Clock clock = Clock.systemUTC();
        private IntUnaryOperator jitter = bound -> ThreadLocalRandom.current().nextInt(bound);
        private ObjectMapper objectMapper = new ObjectMapper();

        private Builder() {}

        /**
         * Sets the gateways and retry constants (defaults to {@link GatewayConfig#defaults()}).
         */
        public Builder config(GatewayConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Replaces the HTTP executor (defaults to {@link HttpRequestExecutor}).
         */
        public Builder executor(RequestExecutor executor) {
            this.executor = Objects.requireNonNull(executor, "executor must not be null");
            return this;
        }

        public Builder reporter(GatewayReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        public Builder delayer(Delayer delayer) {
            this.delayer = Objects.requireNonNull(delayer, "delayer must not be null");
            return this;
        }

        /**
         * Clock used for health timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Source of backoff jitter: given an exclusive bound, returns a value in {@code [0, bound)}.
         */
        public Builder jitter(IntUnaryOperator jitter) {
            this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
            return this;
        }

        /**
         * Mapper for request and response bodies when the default executor is used.
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
            return this;
        }

        public GatewayClient build() {
            return new GatewayClient(this);
        }
    }
}
