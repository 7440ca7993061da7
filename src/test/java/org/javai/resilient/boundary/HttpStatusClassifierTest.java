package org.javai.resilient.boundary;

import org.javai.resilient.Failure;
import org.javai.resilient.FailureCode;
import org.javai.resilient.FailureType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HttpStatusClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "400, INVALID_ARGUMENT",
            "413, INVALID_ARGUMENT",
            "422, INVALID_ARGUMENT",
            "401, UNAUTHENTICATED",
            "403, PERMISSION_DENIED",
            "404, NOT_FOUND",
            "405, NOT_IMPLEMENTED",
            "408, TIMEOUT",
            "504, TIMEOUT",
            "409, ALREADY_EXISTS",
            "429, SERVICE_UNAVAILABLE",
            "503, SERVICE_UNAVAILABLE",
            "500, INTERNAL_ERROR",
            "502, INTERNAL_ERROR",
            "418, INTERNAL_ERROR"
    })
    void codeFor_mapsStatusTable(int status, FailureCode expected) {
        assertThat(HttpStatusClassifier.codeFor(status)).isEqualTo(expected);
    }

    @Test
    void predicates() {
        assertThat(HttpStatusClassifier.isSuccess(204)).isTrue();
        assertThat(HttpStatusClassifier.isSuccess(302)).isFalse();
        assertThat(HttpStatusClassifier.isError(399)).isFalse();
        assertThat(HttpStatusClassifier.isError(400)).isTrue();
        assertThat(HttpStatusClassifier.isRetryable(499)).isFalse();
        assertThat(HttpStatusClassifier.isRetryable(500)).isTrue();
    }

    @Test
    void toFailure_isUpstreamStatus() {
        Failure failure = HttpStatusClassifier.toFailure("DELETE http://svc/items/1", 409);

        assertThat(failure.type()).isEqualTo(FailureType.UPSTREAM_STATUS);
        assertThat(failure.code()).isEqualTo(FailureCode.ALREADY_EXISTS);
        assertThat(failure.status()).isEqualTo(409);
        assertThat(failure.operation()).isEqualTo("DELETE http://svc/items/1");
    }
}
