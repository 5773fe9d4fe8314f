package org.javai.failover.ops;

import org.javai.failover.GatewayError;

import java.time.Duration;

/**
 * Receives gateway activity for logging, metrics and the gateway log file.
 * Reporting never changes how a request is routed.
 */
public interface GatewayReporter {

	/**
	 * Reports one completed HTTP attempt, successful or not.
	 */
	void reportAttempt(GatewayAttempt attempt);

	/**
	 * Reports that the same gateway will be tried again.
	 *
	 * @param failed the attempt that failed
	 * @param delay the backoff before the next attempt
	 */
	default void reportRetry(GatewayAttempt failed, Duration delay) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that a gateway was abandoned in favour of the next one.
	 *
	 * @param last the final attempt on the abandoned gateway
	 * @param nextUrl the gateway tried next
	 * @param delay the backoff before switching
	 */
	default void reportFailover(GatewayAttempt last, String nextUrl, Duration delay) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports that every gateway was exhausted.
	 *
	 * @param error the error returned to the caller
	 * @param gatewayCount the number of gateways tried
	 */
	default void reportExhausted(GatewayError.AllGatewaysFailed error, int gatewayCount) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static GatewayReporter noOp() {
		return attempt -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static GatewayReporter composite(GatewayReporter... reporters) {
		return CompositeGatewayReporter.of(reporters);
	}
}
