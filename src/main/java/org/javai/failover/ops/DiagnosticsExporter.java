package org.javai.failover.ops;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.failover.GatewayClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;

/**
 * Appends a JSON snapshot of a client's configuration and gateway health to a local file,
 * one snapshot per line. Nothing is sent over the network.
 */
public final class DiagnosticsExporter {

	public static final String FILE_NAME = "gateway-diagnostics.jsonl";

	private final Path exportFile;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	/**
	 * Exports to {@code gateway-diagnostics.jsonl} in the configured log directory.
	 */
	public DiagnosticsExporter() {
		this(Path.of(GatewayLogFormat.logDirectory()).resolve(FILE_NAME), new ObjectMapper(), Clock.systemUTC());
	}

	public DiagnosticsExporter(Path exportFile, ObjectMapper objectMapper, Clock clock) {
		this.exportFile = Objects.requireNonNull(exportFile, "exportFile must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	public DiagnosticsSnapshot snapshot(GatewayClient client) {
		return new DiagnosticsSnapshot(
			GatewayLogFormat.rfc3339(clock.instant()),
			client.gatewayConfig(),
			client.healthStats());
	}

	/**
	 * Appends the client's current snapshot as one JSON line.
	 *
	 * @return the snapshot that was written
	 * @throws IOException if the file cannot be written
	 */
	public DiagnosticsSnapshot export(GatewayClient client) throws IOException {
		DiagnosticsSnapshot snapshot = snapshot(client);
		Path parent = exportFile.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(exportFile,
			objectMapper.writeValueAsString(snapshot) + System.lineSeparator(),
			StandardCharsets.UTF_8,
			StandardOpenOption.CREATE, StandardOpenOption.APPEND);
		return snapshot;
	}

	public Path exportFile() {
		return exportFile;
	}
}
