package org.javai.resilient;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FailureTest {

    @Test
    void isRetryable_transportFailures() {
        assertThat(Failure.network("GET http://svc", "refused", new IOException()).isRetryable()).isTrue();
        assertThat(Failure.timeout("GET http://svc", "slow", null).isRetryable()).isTrue();
    }

    @Test
    void isRetryable_onlyServerErrorStatuses() {
        assertThat(Failure.upstreamStatus("GET http://svc", 500, FailureCode.INTERNAL_ERROR).isRetryable()).isTrue();
        assertThat(Failure.upstreamStatus("GET http://svc", 503, FailureCode.SERVICE_UNAVAILABLE).isRetryable()).isTrue();
        assertThat(Failure.upstreamStatus("GET http://svc", 404, FailureCode.NOT_FOUND).isRetryable()).isFalse();
        assertThat(Failure.upstreamStatus("GET http://svc", 429, FailureCode.SERVICE_UNAVAILABLE).isRetryable()).isFalse();
    }

    @Test
    void isRetryable_neverForBreakerOrDecode() {
        assertThat(Failure.breakerOpen("GET http://svc", "svc").isRetryable()).isFalse();
        assertThat(Failure.decodeFailure("GET http://svc", 200, "bad json", null).isRetryable()).isFalse();
    }

    @Test
    void breakerOpen_carriesBreakerNameAndNoStatus() {
        Failure failure = Failure.breakerOpen("GET http://svc", "billing");

        assertThat(failure.type()).isEqualTo(FailureType.BREAKER_OPEN);
        assertThat(failure.code()).isEqualTo(FailureCode.SERVICE_UNAVAILABLE);
        assertThat(failure.hasStatus()).isFalse();
        assertThat(failure.tags()).containsEntry("breaker", "billing");
    }

    @Test
    void decodeFailure_isInternalErrorWithStatus() {
        Failure failure = Failure.decodeFailure("GET http://svc", 200, "bad json", null);

        assertThat(failure.code()).isEqualTo(FailureCode.INTERNAL_ERROR);
        assertThat(failure.status()).isEqualTo(200);
    }

    @Test
    void withContext_mergesTagsAndSetsCorrelationId() {
        Failure failure = Failure.breakerOpen("GET http://svc", "billing")
                .withContext("req-42", Map.of("attempts", "0"));

        assertThat(failure.correlationId()).isEqualTo("req-42");
        assertThat(failure.tags()).containsEntry("breaker", "billing").containsEntry("attempts", "0");
    }

    @Test
    void constructor_requiresCoreFields() {
        assertThatThrownBy(() -> Failure.builder(FailureType.NETWORK, FailureCode.SERVICE_UNAVAILABLE, null, "op").build())
                .isInstanceOf(NullPointerException.class);
    }
}
