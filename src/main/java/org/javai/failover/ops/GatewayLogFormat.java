package org.javai.failover.ops;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Shared configuration lookup and formatting for reporters.
 */
public final class GatewayLogFormat {

	public static final String LOG_DIR_PROPERTY = "failover.log.dir";
	public static final String LOG_DIR_ENV = "FAILOVER_LOG_DIR";
	public static final String DEFAULT_LOG_DIR = "logs";

	private static final DateTimeFormatter RFC_3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

	private GatewayLogFormat() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property, then environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @param defaultValue returned when neither is set
	 * @return the resolved value
	 */
	public static String resolveConfig(String sysProp, String envVar, String defaultValue) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		return value;
	}

	/**
	 * Directory holding {@code gateway.log} and the diagnostics export.
	 */
	public static String logDirectory() {
		return resolveConfig(LOG_DIR_PROPERTY, LOG_DIR_ENV, DEFAULT_LOG_DIR);
	}

	/**
	 * Formats an instant as an RFC 3339 timestamp in UTC, e.g. {@code 2024-01-20T10:30:00.123Z}.
	 */
	public static String rfc3339(Instant instant) {
		return RFC_3339.format(instant.atOffset(ZoneOffset.UTC));
	}

	/**
	 * Collapses line breaks so one event stays on one line.
	 */
	public static String singleLine(String s) {
		if (s == null) return "";
		return s.replace("\r", " ").replace("\n", " ");
	}
}
