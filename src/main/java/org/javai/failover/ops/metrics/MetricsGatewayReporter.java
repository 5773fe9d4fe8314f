package org.javai.failover.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.failover.GatewayError;
import org.javai.failover.boundary.AttemptOutcome;
import org.javai.failover.ops.GatewayAttempt;
import org.javai.failover.ops.GatewayReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Reports gateway activity as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"gateway.primary","url":"https://...","attempt":1,"totalAttempts":1,"success":true,"elapsedMs":84,"message":"OK"}
 * {"eventType":"failover","timestamp":"...","trackingKey":"gateway.primary","from":"https://...","to":"https://...","delayMs":342}
 * }</pre>
 *
 * <p>Reporting never breaks a request: a line that cannot be built is logged at WARN and dropped.
 */
public class MetricsGatewayReporter implements GatewayReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.failover.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public MetricsGatewayReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), new ObjectMapper(), Clock.systemUTC());
	}

	/**
	 * @param namespace prefix for tracking keys (may be null or empty)
	 */
	public MetricsGatewayReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), new ObjectMapper(), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsGatewayReporter(String namespace, Logger logger, ObjectMapper objectMapper, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	@Override
	public void reportAttempt(GatewayAttempt attempt) {
		ObjectNode json = event("attempt", attempt.label());
		json.put("url", attempt.url());
		json.put("attempt", attempt.attemptOnGateway() + 1);
		json.put("totalAttempts", attempt.totalAttempts());
		json.put("success", attempt.succeeded());
		json.put("elapsedMs", attempt.elapsedMs());
		json.put("outcome", outcomeName(attempt.outcome()));
		json.put("message", attempt.message());
		emit(json);
	}

	@Override
	public void reportRetry(GatewayAttempt failed, Duration delay) {
		ObjectNode json = event("retry", failed.label());
		json.put("url", failed.url());
		json.put("attempt", failed.attemptOnGateway() + 1);
		json.put("delayMs", delay.toMillis());
		json.put("message", failed.message());
		emit(json);
	}

	@Override
	public void reportFailover(GatewayAttempt last, String nextUrl, Duration delay) {
		ObjectNode json = event("failover", last.label());
		json.put("from", last.url());
		json.put("to", nextUrl);
		json.put("delayMs", delay.toMillis());
		json.put("message", last.message());
		emit(json);
	}

	@Override
	public void reportExhausted(GatewayError.AllGatewaysFailed error, int gatewayCount) {
		ObjectNode json = event("exhausted", "all");
		json.put("totalAttempts", error.attempts());
		json.put("gateways", gatewayCount);
		json.put("message", error.technicalMessage());
		emit(json);
	}

	String buildTrackingKey(String label) {
		String key = "gateway." + label.toLowerCase(Locale.ROOT);
		if (namespace == null) {
			return key;
		}
		return namespace + "." + key;
	}

	private ObjectNode event(String eventType, String label) {
		ObjectNode json = objectMapper.createObjectNode();
		json.put("eventType", eventType);
		json.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		json.put("trackingKey", buildTrackingKey(label));
		return json;
	}

	private void emit(ObjectNode json) {
		try {
			logger.info(objectMapper.writeValueAsString(json));
		} catch (JsonProcessingException e) {
			logger.warn("Dropping metrics event {}: {}", json.path("eventType").asText(), e.getOriginalMessage());
		}
	}

	private static String outcomeName(AttemptOutcome outcome) {
		return outcome.getClass().getSimpleName();
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
