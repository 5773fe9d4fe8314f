package org.javai.failover.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.failover.GatewayConfig;
import org.javai.failover.GatewayResponse;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Translates what happened on the wire into an {@link AttemptOutcome}.
 *
 * <p>This is the single place where HTTP statuses and checked transport exceptions become
 * outcomes. RuntimeExceptions are defects, not gateway failures, and are never classified here.
 *
 * <table>
 *   <caption>Classification</caption>
 *   <tr><td>2xx, {@code success: true}</td><td>{@link AttemptOutcome.Success}</td></tr>
 *   <tr><td>2xx, {@code success: false} or unreadable body</td><td>retryable {@link AttemptOutcome.ServerError}</td></tr>
 *   <tr><td>429</td><td>{@link AttemptOutcome.RateLimited}</td></tr>
 *   <tr><td>408, {@link HttpTimeoutException}, {@link TimeoutException}</td><td>{@link AttemptOutcome.Timeout}</td></tr>
 *   <tr><td>5xx</td><td>retryable {@link AttemptOutcome.ServerError}</td></tr>
 *   <tr><td>other 4xx</td><td>non-retryable {@link AttemptOutcome.ServerError}</td></tr>
 *   <tr><td>connect, DNS, TLS, other IO</td><td>{@link AttemptOutcome.TransportError}</td></tr>
 * </table>
 */
public class AttemptClassifier {

    public static final long DEFAULT_RETRY_AFTER_SECONDS = 60;

    private static final String UNKNOWN_API_ERROR = "Unknown API error";

    private final ObjectMapper objectMapper;
    private final long timeoutSeconds;

    public AttemptClassifier(ObjectMapper objectMapper) {
        this(objectMapper, GatewayConfig.REQUEST_TIMEOUT.toSeconds());
    }

    public AttemptClassifier(ObjectMapper objectMapper, long timeoutSeconds) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Classifies a received HTTP response.
     *
     * @param status the HTTP status code
     * @param retryAfter the raw {@code Retry-After} header, if present
     * @param body the response body (may be null or empty)
     */
    public AttemptOutcome classifyResponse(int status, Optional<String> retryAfter, String body) {
        if (status == 429) {
            return new AttemptOutcome.RateLimited(parseRetryAfter(retryAfter));
        }
        if (status == 408) {
            return new AttemptOutcome.Timeout(timeoutSeconds);
        }
        if (status >= 200 && status < 300) {
            return classifyBody(status, body);
        }
        // 4xx other than 408/429 will not succeed by asking the same gateway again
        boolean retryable = status >= 500 || status < 400;
        return new AttemptOutcome.ServerError(status, "HTTP " + status, retryable);
    }

    /**
     * Classifies an exception raised while sending the request or awaiting the response.
     *
     * @throws RuntimeException the unwrapped exception itself, when it is a defect
     */
    public AttemptOutcome classifyException(Throwable t) {
        Throwable cause = unwrap(t);

        if (cause instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }

        // HttpConnectTimeoutException is a subtype, so connect timeouts land here too
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return new AttemptOutcome.Timeout(timeoutSeconds);
        }

        if (cause instanceof ConnectException) {
            return new AttemptOutcome.TransportError(messageFor("Connection refused", cause));
        }

        if (cause instanceof UnknownHostException) {
            return new AttemptOutcome.TransportError(messageFor("Unknown host", cause));
        }

        if (cause instanceof SSLException) {
            return new AttemptOutcome.TransportError(messageFor("TLS failure", cause));
        }

        if (cause instanceof IOException) {
            return new AttemptOutcome.TransportError(messageFor("IO error", cause));
        }

        return new AttemptOutcome.TransportError(messageFor(cause.getClass().getSimpleName(), cause));
    }

    private AttemptOutcome classifyBody(int status, String body) {
        if (body == null || body.isBlank()) {
            return AttemptOutcome.ServerError.invalidBody(status, "empty body");
        }
        GatewayResponse response;
        try {
            response = objectMapper.readValue(body, GatewayResponse.class);
        } catch (JsonProcessingException e) {
            return AttemptOutcome.ServerError.invalidBody(status, e.getOriginalMessage());
        }
        if (response == null) {
            return AttemptOutcome.ServerError.invalidBody(status, "null body");
        }
        if (!response.success()) {
            String error = response.error() != null ? response.error() : UNKNOWN_API_ERROR;
            return new AttemptOutcome.ServerError(status, error, true);
        }
        return new AttemptOutcome.Success(response);
    }

    static long parseRetryAfter(Optional<String> header) {
        if (header.isEmpty()) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            long seconds = Long.parseLong(header.get().trim());
            return seconds >= 0 ? seconds : DEFAULT_RETRY_AFTER_SECONDS;
        } catch (NumberFormatException e) {
            // HTTP-date form and garbage both fall back to the default
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageFor(String prefix, Throwable t) {
        return t.getMessage() != null ? prefix + ": " + t.getMessage() : prefix;
    }
}
