package org.javai.failover.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.failover.GatewayError;
import org.javai.failover.boundary.AttemptOutcome;
import org.javai.failover.ops.GatewayAttempt;
import org.javai.failover.ops.GatewayReporter;

import java.time.Duration;

/**
 * Reports gateway activity using Log4j2.
 *
 * <p>Levels and markers:
 * <ul>
 *   <li>successful attempt → INFO</li>
 *   <li>failed attempt → WARN</li>
 *   <li>HTTP 429 → WARN with marker {@code RATE_LIMIT}</li>
 *   <li>retry scheduled → INFO with marker {@code RETRY}</li>
 *   <li>failover → INFO with marker {@code FAILOVER}</li>
 *   <li>all gateways exhausted → ERROR with marker {@code ALL_FAILED}</li>
 * </ul>
 */
public class Log4jGatewayReporter implements GatewayReporter {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.failover.Gateway";

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker FAILOVER_MARKER = MarkerManager.getMarker("FAILOVER");
	static final Marker RATE_LIMIT_MARKER = MarkerManager.getMarker("RATE_LIMIT");
	static final Marker ALL_FAILED_MARKER = MarkerManager.getMarker("ALL_FAILED");

	private final Logger logger;

	public Log4jGatewayReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	public Log4jGatewayReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jGatewayReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportAttempt(GatewayAttempt attempt) {
		if (attempt.outcome() instanceof AttemptOutcome.RateLimited rateLimited) {
			logger.atWarn()
				.withMarker(RATE_LIMIT_MARKER)
				.log("Rate limit triggered by {} gateway [{}]: retry after {} seconds",
					attempt.label(),
					attempt.url(),
					rateLimited.retryAfterSeconds());
			return;
		}

		Level level = attempt.succeeded() ? Level.INFO : Level.WARN;
		logger.atLevel(level)
			.log("{} gateway [{}] attempt {} (call {}) {} in {}ms: {}",
				attempt.label(),
				attempt.url(),
				attempt.attemptOnGateway() + 1,
				attempt.totalAttempts(),
				attempt.succeeded() ? "succeeded" : "failed",
				attempt.elapsedMs(),
				attempt.message());
	}

	@Override
	public void reportRetry(GatewayAttempt failed, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying {} gateway [{}] in {}ms after: {}",
				failed.label(),
				failed.url(),
				delay.toMillis(),
				failed.message());
	}

	@Override
	public void reportFailover(GatewayAttempt last, String nextUrl, Duration delay) {
		logger.atInfo()
			.withMarker(FAILOVER_MARKER)
			.log("Failing over from {} gateway [{}] to [{}] in {}ms. Last error: {}",
				last.label(),
				last.url(),
				nextUrl,
				delay.toMillis(),
				last.message());
	}

	@Override
	public void reportExhausted(GatewayError.AllGatewaysFailed error, int gatewayCount) {
		logger.atError()
			.withMarker(ALL_FAILED_MARKER)
			.log("{} attempts across {} gateways: {}",
				error.attempts(),
				gatewayCount,
				error.technicalMessage());
	}
}
