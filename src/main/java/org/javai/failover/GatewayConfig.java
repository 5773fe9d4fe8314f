package org.javai.failover;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable gateway configuration: the three endpoints in priority order and the retry constants.
 *
 * <p>The priority order is always {@code primary → secondary → fallback}. It is derived from the
 * three URLs and never reordered, so any two clients built from equal configs try gateways in
 * exactly the same order.
 *
 * <p>Serializes to snake_case JSON for diagnostics export:
 * <pre>{@code
 * {"primary":"...","secondary":"...","fallback":"...","max_attempts":3,"max_retries_per_gateway":2,"base_delay_ms":300}
 * }</pre>
 *
 * @param primary URL tried first on every call
 * @param secondary URL tried once the primary is exhausted
 * @param fallback URL tried last
 * @param maxAttempts number of gateways attempted per call (always the gateway count)
 * @param maxRetriesPerGateway additional attempts on a gateway after its initial one
 * @param baseDelayMs base backoff delay, exported for diagnostics
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
        @JsonProperty("primary") String primary,
        @JsonProperty("secondary") String secondary,
        @JsonProperty("fallback") String fallback,
        @JsonProperty("max_attempts") int maxAttempts,
        @JsonProperty("max_retries_per_gateway") int maxRetriesPerGateway,
        @JsonProperty("base_delay_ms") long baseDelayMs
) {

    public static final String DEFAULT_PRIMARY = "https://api.na-backend.odysee.com/api/v1/proxy";
    public static final String DEFAULT_SECONDARY = "https://api.lbry.tv/api/v1/proxy";
    public static final String DEFAULT_FALLBACK = "https://api.odysee.com/api/v1/proxy";

    public static final int GATEWAY_COUNT = 3;
    public static final int DEFAULT_MAX_RETRIES_PER_GATEWAY = 2;
    public static final long DEFAULT_BASE_DELAY_MS = 300;

    /**
     * Budget for a single HTTP attempt against one gateway.
     */
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private static final List<String> LABELS = List.of("PRIMARY", "SECONDARY", "FALLBACK");

    public GatewayConfig {
        requireUrl(primary, "primary");
        requireUrl(secondary, "secondary");
        requireUrl(fallback, "fallback");
        if (maxAttempts != GATEWAY_COUNT) {
            throw new IllegalArgumentException(
                    "maxAttempts must equal the gateway count (" + GATEWAY_COUNT + "), was: " + maxAttempts);
        }
        if (maxRetriesPerGateway < 0) {
            throw new IllegalArgumentException("maxRetriesPerGateway must be >= 0, was: " + maxRetriesPerGateway);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, was: " + baseDelayMs);
        }
    }

    /**
     * The production gateways with the default retry constants.
     */
    public static GatewayConfig defaults() {
        return of(DEFAULT_PRIMARY, DEFAULT_SECONDARY, DEFAULT_FALLBACK);
    }

    /**
     * Creates a config for the given endpoints using the default retry constants.
     */
    public static GatewayConfig of(String primary, String secondary, String fallback) {
        return new GatewayConfig(primary, secondary, fallback,
                GATEWAY_COUNT, DEFAULT_MAX_RETRIES_PER_GATEWAY, DEFAULT_BASE_DELAY_MS);
    }

    /**
     * Returns the gateways in the order they are tried: primary, secondary, fallback.
     *
     * @return an unmodifiable list of exactly three URLs
     */
    public List<String> priorityOrder() {
        return List.of(primary, secondary, fallback);
    }

    /**
     * Returns the configured primary gateway.
     *
     * <p>This does not track which gateway served the most recent request; every call starts
     * at the primary, so the primary is reported unconditionally.
     */
    public String currentGateway() {
        return primary;
    }

    public int gatewayCount() {
        return GATEWAY_COUNT;
    }

    /**
     * Upper bound on HTTP calls for one logical request.
     */
    public int maxPossibleAttempts() {
        return maxAttempts * (maxRetriesPerGateway + 1);
    }

    public Duration requestTimeout() {
        return REQUEST_TIMEOUT;
    }

    /**
     * Human-readable role of the gateway at {@code index}: PRIMARY, SECONDARY or FALLBACK.
     */
    public static String gatewayLabel(int index) {
        if (index < 0 || index >= LABELS.size()) {
            return "UNKNOWN";
        }
        return LABELS.get(index);
    }

    private static void requireUrl(String url, String name) {
        Objects.requireNonNull(url, name + " must not be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
