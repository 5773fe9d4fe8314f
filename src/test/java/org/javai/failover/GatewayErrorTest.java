package org.javai.failover;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class GatewayErrorTest {

    @Test
    void technicalMessages() {
        assertThat(new GatewayError.Gateway("HTTP 502").technicalMessage())
                .isEqualTo("Gateway error: HTTP 502");
        assertThat(new GatewayError.AllGatewaysFailed(7).technicalMessage())
                .isEqualTo("All gateways failed after 7 attempts");
        assertThat(new GatewayError.RateLimitExceeded(30).technicalMessage())
                .isEqualTo("API rate limit exceeded: retry after 30 seconds");
        assertThat(new GatewayError.ApiTimeout(10).technicalMessage())
                .isEqualTo("API timeout: operation took longer than 10 seconds");
        assertThat(new GatewayError.InvalidApiResponse("missing data").technicalMessage())
                .isEqualTo("Invalid API response: missing data");
    }

    @Test
    void userMessages() {
        assertThat(new GatewayError.AllGatewaysFailed(9).userMessage())
                .isEqualTo("All servers are currently unavailable. Please try again later.");
        assertThat(new GatewayError.RateLimitExceeded(45).userMessage())
                .isEqualTo("Too many requests. Please wait 45 seconds before trying again.");
        assertThat(new GatewayError.ApiTimeout(10).userMessage())
                .isEqualTo(GatewayError.GENERIC_USER_MESSAGE);
    }

    @Test
    void recoverability() {
        assertThat(new GatewayError.Gateway("x").isRecoverable()).isTrue();
        assertThat(new GatewayError.RateLimitExceeded(1).isRecoverable()).isTrue();
        assertThat(new GatewayError.ApiTimeout(10).isRecoverable()).isTrue();
        assertThat(new GatewayError.AllGatewaysFailed(3).isRecoverable()).isFalse();
        assertThat(new GatewayError.InvalidApiResponse("x").isRecoverable()).isFalse();
    }

    @Test
    void onlyRateLimitIsWarningLevel() {
        List<GatewayError> errors = List.of(
                new GatewayError.Gateway("x"),
                new GatewayError.AllGatewaysFailed(3),
                new GatewayError.ApiTimeout(10),
                new GatewayError.InvalidApiResponse("x"));

        assertThat(errors).noneMatch(GatewayError::isWarningLevel);
        assertThat(new GatewayError.RateLimitExceeded(1).isWarningLevel()).isTrue();
    }

    @Test
    void everyErrorIsInNetworkCategory() {
        assertThat(new GatewayError.AllGatewaysFailed(3).category()).isEqualTo("network");
        assertThat(new GatewayError.InvalidApiResponse("x").category()).isEqualTo("network");
    }

    @Test
    void serializesWithKindAndMessages() {
        JsonNode json = new ObjectMapper().valueToTree(new GatewayError.RateLimitExceeded(60));

        assertThat(json.get("kind").asText()).isEqualTo("rate_limit_exceeded");
        assertThat(json.get("category").asText()).isEqualTo("network");
        assertThat(json.get("message").asText()).isEqualTo("API rate limit exceeded: retry after 60 seconds");
        assertThat(json.get("user_message").asText()).startsWith("Too many requests");
        assertThat(json.get("recoverable").asBoolean()).isTrue();
        assertThat(json.get("warning_level").asBoolean()).isTrue();
        assertThat(json.get("retry_after_seconds").asLong()).isEqualTo(60);
    }

    @Test
    void gatewayException_carriesError() {
        GatewayError error = new GatewayError.AllGatewaysFailed(3);

        GatewayException exception = new GatewayException(error);

        assertThat(exception.error()).isSameAs(error);
        assertThat(exception).hasMessage("All gateways failed after 3 attempts");
    }
}
