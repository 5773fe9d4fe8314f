package org.javai.failover.boundary;

import org.javai.failover.GatewayError;
import org.javai.failover.GatewayResponse;

import java.util.Objects;

/**
 * The classified result of exactly one HTTP attempt against one gateway.
 */
public sealed interface AttemptOutcome permits
        AttemptOutcome.Success,
        AttemptOutcome.RateLimited,
        AttemptOutcome.Timeout,
        AttemptOutcome.TransportError,
        AttemptOutcome.ServerError {

    /**
     * 2xx with a body reporting {@code success: true}.
     */
    record Success(GatewayResponse response) implements AttemptOutcome {
        public Success {
            Objects.requireNonNull(response, "response must not be null");
        }

        @Override
        public GatewayError toError() {
            throw new IllegalStateException("a successful attempt has no error");
        }

        @Override
        public String describe() {
            return "OK";
        }
    }

    /**
     * HTTP 429. Never retried on the same gateway.
     */
    record RateLimited(long retryAfterSeconds) implements AttemptOutcome {
        @Override
        public GatewayError toError() {
            return new GatewayError.RateLimitExceeded(retryAfterSeconds);
        }
    }

    /**
     * The request budget elapsed, or the gateway answered HTTP 408.
     */
    record Timeout(long timeoutSeconds) implements AttemptOutcome {
        @Override
        public GatewayError toError() {
            return new GatewayError.ApiTimeout(timeoutSeconds);
        }
    }

    /**
     * Connection, DNS or TLS failure before any HTTP status was received.
     */
    record TransportError(String message) implements AttemptOutcome {
        public TransportError {
            message = message == null ? "connection failed" : message;
        }

        @Override
        public GatewayError toError() {
            return new GatewayError.Gateway("Network error: " + message);
        }
    }

    /**
     * Any other unsuccessful answer: a non-2xx status, an unparseable body, or a body reporting
     * {@code success: false}.
     *
     * @param status the HTTP status code
     * @param message what went wrong
     * @param retryable whether the same gateway may be tried again
     * @param malformedBody whether the body of a 2xx answer could not be decoded at all
     */
    record ServerError(int status, String message, boolean retryable, boolean malformedBody)
            implements AttemptOutcome {

        public ServerError {
            message = message == null ? "HTTP " + status : message;
        }

        public ServerError(int status, String message, boolean retryable) {
            this(status, message, retryable, false);
        }

        /**
         * A 2xx whose body could not be decoded. Retryable, reported as an invalid response.
         */
        public static ServerError invalidBody(int status, String detail) {
            return new ServerError(status, detail, true, true);
        }

        @Override
        public GatewayError toError() {
            if (malformedBody) {
                return new GatewayError.InvalidApiResponse(message);
            }
            return new GatewayError.Gateway(message);
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Whether this outcome permits another attempt on the same gateway, ignoring attempt limits.
     */
    default boolean retryableOnSameGateway() {
        if (this instanceof ServerError serverError) {
            return serverError.retryable();
        }
        return this instanceof Timeout || this instanceof TransportError;
    }

    /**
     * The error this failed attempt represents.
     *
     * @throws IllegalStateException for {@link Success}
     */
    GatewayError toError();

    /**
     * Message recorded as a gateway's last error.
     */
    default String describe() {
        return toError().technicalMessage();
    }
}
