package org.javai.failover.ops;

import org.javai.failover.boundary.AttemptOutcome;

import java.util.Objects;

/**
 * One HTTP attempt as seen by reporters.
 *
 * @param gatewayIndex position of the gateway in the priority order
 * @param url the gateway URL
 * @param label PRIMARY, SECONDARY or FALLBACK
 * @param attemptOnGateway 0-based attempt number on this gateway
 * @param totalAttempts 1-based count of HTTP calls made so far for the logical request
 * @param outcome the classified result
 * @param elapsedMs wall-clock duration of the attempt
 */
public record GatewayAttempt(
        int gatewayIndex,
        String url,
        String label,
        int attemptOnGateway,
        int totalAttempts,
        AttemptOutcome outcome,
        long elapsedMs
) {

    public GatewayAttempt {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public boolean succeeded() {
        return outcome.isSuccess();
    }

    /**
     * "OK" on success, otherwise the technical error message.
     */
    public String message() {
        return outcome.describe();
    }
}
