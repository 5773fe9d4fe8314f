package org.javai.failover.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Last observed state of a gateway.
 */
public enum GatewayStatus {
    /**
     * No attempt has been made against the gateway yet.
     */
    UNKNOWN,

    /**
     * The most recent attempt succeeded.
     */
    HEALTHY,

    /**
     * The most recent attempt failed.
     */
    UNHEALTHY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
