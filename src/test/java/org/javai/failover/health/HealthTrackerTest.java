package org.javai.failover.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.failover.GatewayResponse;
import org.javai.failover.boundary.AttemptOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class HealthTrackerTest {

    private static final List<String> GATEWAYS = List.of("https://a.test", "https://b.test", "https://c.test");
    private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");

    private static final AttemptOutcome SUCCESS = new AttemptOutcome.Success(GatewayResponse.ok(null));
    private static final AttemptOutcome TIMEOUT = new AttemptOutcome.Timeout(10);

    private HealthTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new HealthTracker(GATEWAYS, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void newTracker_hasUnknownRecordsWithEmptyFields() {
        List<GatewayHealth> snapshot = tracker.snapshot();

        assertThat(snapshot).hasSize(3);
        assertThat(snapshot).extracting(GatewayHealth::url).containsExactlyElementsOf(GATEWAYS);
        assertThat(snapshot).allSatisfy(h -> {
            assertThat(h.status()).isEqualTo(GatewayStatus.UNKNOWN);
            assertThat(h.lastSuccessTime()).isEmpty();
            assertThat(h.lastErrorMessage()).isEmpty();
            assertThat(h.lastResponseTimeMs()).isEmpty();
        });
    }

    @Test
    void recordAttempt_success_marksHealthy() {
        tracker.recordAttempt(0, SUCCESS, 85);

        GatewayHealth health = tracker.health(0);
        assertThat(health.status()).isEqualTo(GatewayStatus.HEALTHY);
        assertThat(health.lastSuccessTime()).contains(NOW);
        assertThat(health.responseTimeMs()).isEqualTo(85L);
        assertThat(health.lastError()).isNull();
    }

    @Test
    void recordAttempt_failure_keepsLastSuccessAndOverwritesResponseTime() {
        tracker.recordAttempt(1, SUCCESS, 85);
        tracker.recordAttempt(1, TIMEOUT, 10_003);

        GatewayHealth health = tracker.health(1);
        assertThat(health.status()).isEqualTo(GatewayStatus.UNHEALTHY);
        assertThat(health.lastSuccess()).isEqualTo(NOW.getEpochSecond());
        assertThat(health.lastError()).isEqualTo("API timeout: operation took longer than 10 seconds");
        assertThat(health.responseTimeMs()).isEqualTo(10_003L);
    }

    @Test
    void recordAttempt_successAfterFailure_clearsLastError() {
        tracker.recordAttempt(2, new AttemptOutcome.TransportError("Connection refused"), 3);
        tracker.recordAttempt(2, SUCCESS, 40);

        assertThat(tracker.health(2).lastError()).isNull();
        assertThat(tracker.health(2).status()).isEqualTo(GatewayStatus.HEALTHY);
    }

    @Test
    void recordAttempt_onlyTouchesItsGateway() {
        tracker.recordAttempt(0, TIMEOUT, 10);

        assertThat(tracker.health(1)).isEqualTo(GatewayHealth.unknown(GATEWAYS.get(1)));
        assertThat(tracker.health(2)).isEqualTo(GatewayHealth.unknown(GATEWAYS.get(2)));
    }

    @Test
    void recordAttempt_indexOutOfRange_throws() {
        assertThatThrownBy(() -> tracker.recordAttempt(3, SUCCESS, 1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> tracker.health(-1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void snapshot_isUnmodifiableAndDetached() {
        List<GatewayHealth> before = tracker.snapshot();
        tracker.recordAttempt(0, SUCCESS, 1);

        assertThat(before.get(0).status()).isEqualTo(GatewayStatus.UNKNOWN);
        assertThatThrownBy(() -> before.add(GatewayHealth.unknown("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void recordAttempt_concurrentCallers_neverCorruptRecords() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 1_000; i++) {
                int index = i % 3;
                AttemptOutcome outcome = i % 2 == 0 ? SUCCESS : TIMEOUT;
                pool.submit(() -> tracker.recordAttempt(index, outcome, 5));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(tracker.snapshot()).hasSize(3)
                .allSatisfy(h -> assertThat(h.status()).isIn(GatewayStatus.HEALTHY, GatewayStatus.UNHEALTHY));
    }

    @Test
    void gatewayHealth_serializesForDiagnostics() {
        tracker.recordAttempt(0, SUCCESS, 85);
        ObjectMapper mapper = new ObjectMapper();

        JsonNode primary = mapper.valueToTree(tracker.health(0));
        JsonNode secondary = mapper.valueToTree(tracker.health(1));

        assertThat(primary.get("status").asText()).isEqualTo("healthy");
        assertThat(primary.get("last_success").asLong()).isEqualTo(NOW.getEpochSecond());
        assertThat(primary.get("response_time_ms").asLong()).isEqualTo(85L);
        assertThat(secondary.get("status").asText()).isEqualTo("unknown");
        assertThat(secondary.get("last_error").isNull()).isTrue();
        assertThat(secondary.has("lastSuccessTime")).isFalse();
    }
}
