package org.javai.failover.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Snapshot of one gateway's health, used only for diagnostics and never for routing.
 *
 * @param url the gateway URL
 * @param status the state after the most recent attempt
 * @param lastSuccess epoch seconds of the most recent success (may be null)
 * @param lastError message of the most recent failure, cleared by a success (may be null)
 * @param responseTimeMs elapsed time of the most recent attempt, successful or not (may be null)
 */
public record GatewayHealth(
        @JsonProperty("url") String url,
        @JsonProperty("status") GatewayStatus status,
        @JsonProperty("last_success") Long lastSuccess,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("response_time_ms") Long responseTimeMs
) {

    public GatewayHealth {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * A gateway that has not been tried yet.
     */
    public static GatewayHealth unknown(String url) {
        return new GatewayHealth(url, GatewayStatus.UNKNOWN, null, null, null);
    }

    @JsonIgnore
    public Optional<Instant> lastSuccessTime() {
        return lastSuccess == null ? Optional.empty() : Optional.of(Instant.ofEpochSecond(lastSuccess));
    }

    @JsonIgnore
    public Optional<String> lastErrorMessage() {
        return Optional.ofNullable(lastError);
    }

    @JsonIgnore
    public OptionalLong lastResponseTimeMs() {
        return responseTimeMs == null ? OptionalLong.empty() : OptionalLong.of(responseTimeMs);
    }

    GatewayHealth succeeded(long epochSeconds, long elapsedMs) {
        return new GatewayHealth(url, GatewayStatus.HEALTHY, epochSeconds, null, elapsedMs);
    }

    GatewayHealth failed(String error, long elapsedMs) {
        return new GatewayHealth(url, GatewayStatus.UNHEALTHY, lastSuccess, error, elapsedMs);
    }
}
