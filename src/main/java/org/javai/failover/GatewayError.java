package org.javai.failover;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Errors that can cross the client boundary, or be recorded against a gateway.
 *
 * <p>Every error carries two messages: a technical one for logs and diagnostics, and a short
 * one suitable for display to an end user. All errors belong to the {@code "network"} category.
 *
 * <p>Serialized with Jackson as
 * {@code {"kind", "category", "message", "user_message", "recoverable", "warning_level", ...}}
 * followed by the error's own fields.
 */
@JsonPropertyOrder({"kind", "category", "message", "user_message", "recoverable", "warning_level"})
public sealed interface GatewayError permits
        GatewayError.Gateway,
        GatewayError.AllGatewaysFailed,
        GatewayError.RateLimitExceeded,
        GatewayError.ApiTimeout,
        GatewayError.InvalidApiResponse {

    String CATEGORY_NETWORK = "network";

    String GENERIC_USER_MESSAGE = "An unexpected error occurred. Please try again.";

    /**
     * A single gateway returned an error or could not be reached.
     */
    record Gateway(@JsonProperty("detail") String detail) implements GatewayError {
        public Gateway {
            detail = detail == null ? "unknown gateway error" : detail;
        }

        @Override
        public String kind() {
            return "gateway";
        }

        @Override
        public String technicalMessage() {
            return "Gateway error: " + detail;
        }

        @Override
        public boolean isRecoverable() {
            return true;
        }
    }

    /**
     * Every gateway was exhausted without a successful response.
     *
     * @param attempts the number of HTTP calls actually made
     */
    record AllGatewaysFailed(@JsonProperty("attempts") int attempts) implements GatewayError {
        @Override
        public String kind() {
            return "all_gateways_failed";
        }

        @Override
        public String technicalMessage() {
            return "All gateways failed after " + attempts + " attempts";
        }

        @Override
        public String userMessage() {
            return "All servers are currently unavailable. Please try again later.";
        }

        @Override
        public boolean isRecoverable() {
            return false;
        }
    }

    /**
     * A gateway answered HTTP 429.
     */
    record RateLimitExceeded(@JsonProperty("retry_after_seconds") long retryAfterSeconds) implements GatewayError {
        @Override
        public String kind() {
            return "rate_limit_exceeded";
        }

        @Override
        public String technicalMessage() {
            return "API rate limit exceeded: retry after " + retryAfterSeconds + " seconds";
        }

        @Override
        public String userMessage() {
            return "Too many requests. Please wait " + retryAfterSeconds + " seconds before trying again.";
        }

        @Override
        public boolean isRecoverable() {
            return true;
        }

        @Override
        public boolean isWarningLevel() {
            return true;
        }
    }

    /**
     * A gateway did not answer within the request timeout, or answered HTTP 408.
     */
    record ApiTimeout(@JsonProperty("timeout_seconds") long timeoutSeconds) implements GatewayError {
        @Override
        public String kind() {
            return "api_timeout";
        }

        @Override
        public String technicalMessage() {
            return "API timeout: operation took longer than " + timeoutSeconds + " seconds";
        }

        @Override
        public boolean isRecoverable() {
            return true;
        }
    }

    /**
     * A response body that could not be understood.
     */
    record InvalidApiResponse(@JsonProperty("detail") String detail) implements GatewayError {
        public InvalidApiResponse {
            detail = detail == null ? "unreadable response" : detail;
        }

        @Override
        public String kind() {
            return "invalid_api_response";
        }

        @Override
        public String technicalMessage() {
            return "Invalid API response: " + detail;
        }

        @Override
        public boolean isRecoverable() {
            return false;
        }
    }

    /**
     * Stable snake_case identifier of the error kind.
     */
    @JsonProperty("kind")
    String kind();

    @JsonProperty("category")
    default String category() {
        return CATEGORY_NETWORK;
    }

    /**
     * Detailed description for logs and diagnostics.
     */
    @JsonProperty("message")
    String technicalMessage();

    /**
     * Short description suitable for showing to an end user.
     */
    @JsonProperty("user_message")
    default String userMessage() {
        return GENERIC_USER_MESSAGE;
    }

    /**
     * Whether trying the operation again later may succeed.
     */
    @JsonProperty("recoverable")
    boolean isRecoverable();

    /**
     * Whether this error is expected behaviour that should be logged at WARN rather than ERROR.
     */
    @JsonProperty("warning_level")
    default boolean isWarningLevel() {
        return false;
    }
}
