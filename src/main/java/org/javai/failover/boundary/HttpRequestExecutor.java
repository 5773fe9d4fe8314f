package org.javai.failover.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.failover.GatewayConfig;
import org.javai.failover.GatewayRequest;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link RequestExecutor} backed by the JDK {@link HttpClient}.
 *
 * <p>POSTs the request as JSON with a fixed per-attempt timeout covering headers and body and classifies the result with
 * an {@link AttemptClassifier}. The caller's thread is not blocked while the response is awaited.
 */
public class HttpRequestExecutor implements RequestExecutor {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AttemptClassifier classifier;
    private final Duration timeout;

    /**
     * Creates an executor with its own HttpClient and the standard 10 second timeout.
     */
    public HttpRequestExecutor(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(GatewayConfig.REQUEST_TIMEOUT)
                        .build(),
                objectMapper,
                GatewayConfig.REQUEST_TIMEOUT);
    }

    public HttpRequestExecutor(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.classifier = new AttemptClassifier(objectMapper, Math.max(1, timeout.toSeconds()));
    }

    @Override
    public CompletableFuture<AttemptOutcome> execute(String gatewayUrl, GatewayRequest request) {
        Objects.requireNonNull(gatewayUrl, "gatewayUrl must not be null");
        Objects.requireNonNull(request, "request must not be null");

        HttpRequest httpRequest = HttpRequest.newBuilder(URI.create(gatewayUrl))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(encode(request)))
                .build();

        // the request timeout stops once headers arrive, so the whole exchange is bounded here
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return classifier.classifyException(error);
                    }
                    return classifier.classifyResponse(
                            response.statusCode(),
                            response.headers().firstValue("Retry-After"),
                            response.body());
                });
    }

    private String encode(GatewayRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            // params is already a JsonNode tree, so this is a programming error
            throw new IllegalArgumentException("Request is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
