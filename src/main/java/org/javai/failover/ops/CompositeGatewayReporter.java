package org.javai.failover.ops;

import org.javai.failover.GatewayError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link GatewayReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every event. If a reporter throws, the exception is
 * logged to stderr and the remaining reporters still run; the request itself is unaffected.
 *
 * <pre>{@code
 * GatewayReporter reporter = CompositeGatewayReporter.builder()
 *     .add(new Log4jGatewayReporter())
 *     .add(new GatewayLogFileReporter())
 *     .addIf(metricsEnabled, new MetricsGatewayReporter())
 *     .build();
 * }</pre>
 */
public final class CompositeGatewayReporter implements GatewayReporter {

	private final List<GatewayReporter> reporters;

	private CompositeGatewayReporter(List<GatewayReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeGatewayReporter of(GatewayReporter... reporters) {
		return new CompositeGatewayReporter(Arrays.asList(reporters));
	}

	public static CompositeGatewayReporter of(Collection<? extends GatewayReporter> reporters) {
		return new CompositeGatewayReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportAttempt(GatewayAttempt attempt) {
		forEach("reportAttempt", reporter -> reporter.reportAttempt(attempt));
	}

	@Override
	public void reportRetry(GatewayAttempt failed, Duration delay) {
		forEach("reportRetry", reporter -> reporter.reportRetry(failed, delay));
	}

	@Override
	public void reportFailover(GatewayAttempt last, String nextUrl, Duration delay) {
		forEach("reportFailover", reporter -> reporter.reportFailover(last, nextUrl, delay));
	}

	@Override
	public void reportExhausted(GatewayError.AllGatewaysFailed error, int gatewayCount) {
		forEach("reportExhausted", reporter -> reporter.reportExhausted(error, gatewayCount));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void forEach(String method, Consumer<GatewayReporter> call) {
		for (GatewayReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				logReporterError(method, reporter, e);
			}
		}
	}

	private static void logReporterError(String method, GatewayReporter reporter, Exception e) {
		System.err.println("GatewayReporter." + method + " failed for " +
			reporter.getClass().getName() + ": " + e.getMessage());
	}

	/**
	 * Builder for creating a {@link CompositeGatewayReporter}. Null reporters are skipped.
	 */
	public static final class Builder {
		private final List<GatewayReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(GatewayReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends GatewayReporter> reporters) {
			for (GatewayReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Adds the reporter only when {@code condition} is true.
		 */
		public Builder addIf(boolean condition, GatewayReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeGatewayReporter build() {
			return new CompositeGatewayReporter(reporters);
		}
	}
}
