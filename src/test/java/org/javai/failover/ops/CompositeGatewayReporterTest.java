package org.javai.failover.ops;

import org.javai.failover.GatewayError;
import org.javai.failover.boundary.AttemptOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeGatewayReporterTest {

	private static final GatewayAttempt ATTEMPT = new GatewayAttempt(
		0, "https://primary.test", "PRIMARY", 0, 1, new AttemptOutcome.Timeout(10), 10_001);

	@Test
	void fansOutEveryEventToAllReporters() {
		List<String> first = new ArrayList<>();
		List<String> second = new ArrayList<>();
		GatewayReporter composite = GatewayReporter.composite(recording(first), recording(second));

		composite.reportAttempt(ATTEMPT);
		composite.reportRetry(ATTEMPT, Duration.ofMillis(200));
		composite.reportFailover(ATTEMPT, "https://secondary.test", Duration.ofMillis(300));
		composite.reportExhausted(new GatewayError.AllGatewaysFailed(9), 3);

		assertThat(first).containsExactly("attempt", "retry 200", "failover https://secondary.test", "exhausted 9");
		assertThat(second).isEqualTo(first);
	}

	@Test
	void failingReporter_doesNotStopOthers() {
		List<String> events = new ArrayList<>();
		GatewayReporter failing = attempt -> {
			throw new IllegalStateException("boom");
		};

		CompositeGatewayReporter composite = CompositeGatewayReporter.of(failing, recording(events));
		composite.reportAttempt(ATTEMPT);

		assertThat(events).containsExactly("attempt");
	}

	@Test
	void builder_skipsNullsAndHonoursCondition() {
		CompositeGatewayReporter composite = CompositeGatewayReporter.builder()
			.add(GatewayReporter.noOp())
			.add(null)
			.addIf(false, GatewayReporter.noOp())
			.addIf(true, GatewayReporter.noOp())
			.addAll(List.of(GatewayReporter.noOp()))
			.build();

		assertThat(composite.size()).isEqualTo(3);
	}

	@Test
	void defaultMethods_areNoOps() {
		GatewayReporter reporter = GatewayReporter.noOp();

		assertThatCode(() -> {
			reporter.reportAttempt(ATTEMPT);
			reporter.reportRetry(ATTEMPT, Duration.ZERO);
			reporter.reportFailover(ATTEMPT, "x", Duration.ZERO);
			reporter.reportExhausted(new GatewayError.AllGatewaysFailed(3), 3);
		}).doesNotThrowAnyException();
	}

	private static GatewayReporter recording(List<String> events) {
		return new GatewayReporter() {
			@Override
			public void reportAttempt(GatewayAttempt attempt) {
				events.add("attempt");
			}

			@Override
			public void reportRetry(GatewayAttempt failed, Duration delay) {
				events.add("retry " + delay.toMillis());
			}

			@Override
			public void reportFailover(GatewayAttempt last, String nextUrl, Duration delay) {
				events.add("failover " + nextUrl);
			}

			@Override
			public void reportExhausted(GatewayError.AllGatewaysFailed error, int gatewayCount) {
				events.add("exhausted " + error.attempts());
			}
		};
	}
}
