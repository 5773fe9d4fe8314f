package org.javai.failover.ops;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.javai.failover.GatewayConfig;
import org.javai.failover.health.GatewayHealth;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time view of the client for troubleshooting exports.
 *
 * @param timestamp RFC 3339 time the snapshot was taken
 * @param gatewayConfig the configured gateways and constants
 * @param gatewayHealth per-gateway health in priority order
 */
@JsonPropertyOrder({"timestamp", "gateway_config", "gateway_health"})
public record DiagnosticsSnapshot(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("gateway_config") GatewayConfig gatewayConfig,
        @JsonProperty("gateway_health") List<GatewayHealth> gatewayHealth
) {

    public DiagnosticsSnapshot {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(gatewayConfig, "gatewayConfig must not be null");
        gatewayHealth = List.copyOf(gatewayHealth);
    }
}
