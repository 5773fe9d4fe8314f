package org.javai.failover.ops.file;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.failover.GatewayError;
import org.javai.failover.ops.GatewayAttempt;
import org.javai.failover.ops.GatewayLogFormat;
import org.javai.failover.ops.GatewayReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;

/**
 * Appends gateway activity to a plain-text, pipe-delimited {@code gateway.log}.
 *
 * <p>Each attempt produces two lines, the attempt itself and the resulting health check:
 * <pre>
 * 2024-01-20T10:30:00.123Z | FAILURE | https://... | 10004ms | API timeout: operation took longer than 10 seconds
 * 2024-01-20T10:30:00.123Z | HEALTH_CHECK | UNHEALTHY | https://... | 10004ms
 * </pre>
 * Exhaustion adds
 * {@code <timestamp> | ALL_FAILED | 7 attempts across 3 gateways | All gateways failed after 7 attempts}.
 *
 * <p>Write failures are logged and never propagate into the request.
 */
public class GatewayLogFileReporter implements GatewayReporter {

	public static final String FILE_NAME = "gateway.log";

	private static final Logger logger = LogManager.getLogger(GatewayLogFileReporter.class);

	private final Path logFile;
	private final Clock clock;

	/**
	 * Writes to {@code gateway.log} in the directory named by {@code failover.log.dir} or
	 * {@code FAILOVER_LOG_DIR}, defaulting to {@code logs}.
	 */
	public GatewayLogFileReporter() {
		this(Path.of(GatewayLogFormat.logDirectory()).resolve(FILE_NAME), Clock.systemUTC());
	}

	public GatewayLogFileReporter(Path logFile, Clock clock) {
		this.logFile = Objects.requireNonNull(logFile, "logFile must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Override
	public void reportAttempt(GatewayAttempt attempt) {
		String timestamp = GatewayLogFormat.rfc3339(clock.instant());
		String attemptLine = String.join(" | ",
			timestamp,
			attempt.succeeded() ? "SUCCESS" : "FAILURE",
			attempt.url(),
			attempt.elapsedMs() + "ms",
			GatewayLogFormat.singleLine(attempt.message()));
		String healthLine = String.join(" | ",
			timestamp,
			"HEALTH_CHECK",
			attempt.succeeded() ? "HEALTHY" : "UNHEALTHY",
			attempt.url(),
			attempt.elapsedMs() + "ms");
		append(attemptLine + System.lineSeparator() + healthLine + System.lineSeparator());
	}

	@Override
	public void reportExhausted(GatewayError.AllGatewaysFailed error, int gatewayCount) {
		String line = String.join(" | ",
			GatewayLogFormat.rfc3339(clock.instant()),
			"ALL_FAILED",
			error.attempts() + " attempts across " + gatewayCount + " gateways",
			error.technicalMessage());
		append(line + System.lineSeparator());
	}

	public Path logFile() {
		return logFile;
	}

	private synchronized void append(String text) {
		try {
			Path parent = logFile.getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(logFile, text, StandardCharsets.UTF_8,
				StandardOpenOption.CREATE, StandardOpenOption.APPEND);
		} catch (IOException e) {
			logger.warn("Could not write to gateway log {}: {}", logFile, e.getMessage());
		}
	}
}
