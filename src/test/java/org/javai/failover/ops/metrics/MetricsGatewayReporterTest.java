package org.javai.failover.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.failover.GatewayError;
import org.javai.failover.GatewayResponse;
import org.javai.failover.boundary.AttemptOutcome;
import org.javai.failover.ops.GatewayAttempt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsGatewayReporterTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-20T10:30:00Z"), ZoneOffset.UTC);

	private final ObjectMapper objectMapper = new ObjectMapper();
	private List<String> capturedMessages;
	private MetricsGatewayReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		reporter = new MetricsGatewayReporter(null, new CapturingLogger(capturedMessages), objectMapper, CLOCK);
	}

	private static GatewayAttempt attempt(AttemptOutcome outcome) {
		return new GatewayAttempt(1, "https://secondary.test", "SECONDARY", 2, 6, outcome, 412);
	}

	private JsonNode onlyEvent() throws Exception {
		assertThat(capturedMessages).hasSize(1);
		return objectMapper.readTree(capturedMessages.get(0));
	}

	@Test
	void reportAttempt_emitsAttemptEvent() throws Exception {
		reporter.reportAttempt(attempt(new AttemptOutcome.Success(GatewayResponse.ok(null))));

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("attempt");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("gateway.secondary");
		assertThat(json.get("url").asText()).isEqualTo("https://secondary.test");
		assertThat(json.get("attempt").asInt()).isEqualTo(3);
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(6);
		assertThat(json.get("success").asBoolean()).isTrue();
		assertThat(json.get("elapsedMs").asLong()).isEqualTo(412);
		assertThat(json.get("outcome").asText()).isEqualTo("Success");
	}

	@Test
	void reportAttempt_escapesMessageText() throws Exception {
		reporter.reportAttempt(attempt(new AttemptOutcome.ServerError(200, "bad \"quote\"\nline", true)));

		assertThat(capturedMessages.get(0)).doesNotContain("\n");
		assertThat(onlyEvent().get("message").asText()).isEqualTo("Gateway error: bad \"quote\"\nline");
	}

	@Test
	void reportRetry_includesDelay() throws Exception {
		reporter.reportRetry(attempt(new AttemptOutcome.Timeout(10)), Duration.ofMillis(523));

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry");
		assertThat(json.get("delayMs").asLong()).isEqualTo(523);
	}

	@Test
	void reportFailover_includesBothGateways() throws Exception {
		reporter.reportFailover(attempt(new AttemptOutcome.RateLimited(60)), "https://fallback.test", Duration.ofMillis(1042));

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("failover");
		assertThat(json.get("from").asText()).isEqualTo("https://secondary.test");
		assertThat(json.get("to").asText()).isEqualTo("https://fallback.test");
		assertThat(json.get("message").asText()).isEqualTo("API rate limit exceeded: retry after 60 seconds");
	}

	@Test
	void reportExhausted_includesTotals() throws Exception {
		reporter.reportExhausted(new GatewayError.AllGatewaysFailed(9), 3);

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("exhausted");
		assertThat(json.get("trackingKey").asText()).isEqualTo("gateway.all");
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(9);
		assertThat(json.get("gateways").asInt()).isEqualTo(3);
	}

	@Test
	void namespace_prependsToTrackingKey() {
		MetricsGatewayReporter namespaced = new MetricsGatewayReporter("myapp", new CapturingLogger(capturedMessages), objectMapper, CLOCK);

		assertThat(namespaced.buildTrackingKey("PRIMARY")).isEqualTo("myapp.gateway.primary");
	}

	@Test
	void blankNamespace_isIgnored() {
		MetricsGatewayReporter blank = new MetricsGatewayReporter("  ", new CapturingLogger(capturedMessages), objectMapper, CLOCK);

		assertThat(blank.buildTrackingKey("FALLBACK")).isEqualTo("gateway.fallback");
	}

	private static class CapturingLogger extends AbstractLogger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "test";
		}

		@Override
		protected String getFullyQualifiedCallerName() {
			return null;
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			messages.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isTraceEnabled(Marker marker) { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isDebugEnabled(Marker marker) { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isInfoEnabled(Marker marker) { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isWarnEnabled(Marker marker) { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		public boolean isErrorEnabled(Marker marker) { return true; }
	}
}
