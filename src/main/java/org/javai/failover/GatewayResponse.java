package org.javai.failover;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded gateway response body.
 *
 * @param success whether the gateway reports the call as successful
 * @param error the gateway's error text (may be null)
 * @param data the result payload, interpreted by the caller (may be null)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayResponse(boolean success, String error, JsonNode data) {

    public static GatewayResponse ok(JsonNode data) {
        return new GatewayResponse(true, null, data);
    }
}
