package org.javai.failover;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * A JSON-RPC-style call sent unchanged to whichever gateway serves it.
 *
 * @param method the remote method (e.g. {@code claim_search}, {@code resolve})
 * @param params method parameters, sent as-is
 */
public record GatewayRequest(String method, JsonNode params) {

    public GatewayRequest {
        Objects.requireNonNull(method, "method must not be null");
        if (method.isBlank()) {
            throw new IllegalArgumentException("method must not be blank");
        }
        params = params == null ? JsonNodeFactory.instance.objectNode() : params;
    }

    public static GatewayRequest of(String method, JsonNode params) {
        return new GatewayRequest(method, params);
    }
}
