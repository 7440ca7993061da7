package org.javai.resilient.client;

import org.javai.resilient.Failure;
import org.javai.resilient.FailureCode;
import org.javai.resilient.FailureType;
import org.javai.resilient.Outcome;
import org.javai.resilient.breaker.CircuitState;
import org.javai.resilient.ops.CallMetadata;
import org.javai.resilient.support.MutableClock;
import org.javai.resilient.support.RecordingOpReporter;
import org.javai.resilient.support.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ResilientHttpClientTest {

    private static final HttpRequest GET_ORDERS = HttpRequest.newBuilder(URI.create("http://svc.test/orders")).GET().build();

    private MutableClock clock;
    private RecordingOpReporter reporter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        reporter = new RecordingOpReporter();
    }

    @Test
    void serverErrorsUpToThreshold_openBreakerAndStopReachingTransport() {
        ScriptedTransport transport = ScriptedTransport.statuses(500);
        ResilientHttpClient client = client(transport, config(1, 3));

        for (int i = 0; i < 3; i++) {
            Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);
            assertThat(result.findFailure().map(Failure::type)).contains(FailureType.UPSTREAM_STATUS);
        }
        assertThat(client.breaker().state()).isEqualTo(CircuitState.OPEN);
        assertThat(transport.calls()).isEqualTo(6);

        Outcome<HttpResponse<byte[]>> rejected = client.send(GET_ORDERS);

        Failure failure = rejected.findFailure().orElseThrow();
        assertThat(failure.type()).isEqualTo(FailureType.BREAKER_OPEN);
        assertThat(failure.code()).isEqualTo(FailureCode.SERVICE_UNAVAILABLE);
        assertThat(failure.tags()).containsEntry("attempts", "0");
        assertThat(transport.calls()).isEqualTo(6);
    }

    @Test
    void serverErrorThenSuccess_returnsResponseAndLeavesBreakerClean() {
        ScriptedTransport transport = ScriptedTransport.statuses(500, 200);
        ResilientHttpClient client = client(transport, config(3, 3));

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        assertThat(result.getOrThrow().statusCode()).isEqualTo(200);
        assertThat(transport.calls()).isEqualTo(2);
        assertThat(client.breaker().consecutiveFailures()).isZero();
        assertThat(client.breaker().state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void notFound_isNotRetriedAndMapsToNotFound() {
        ScriptedTransport transport = ScriptedTransport.statuses(404);
        ResilientHttpClient client = client(transport, config(3, 3));

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        Failure failure = result.findFailure().orElseThrow();
        assertThat(failure.type()).isEqualTo(FailureType.UPSTREAM_STATUS);
        assertThat(failure.code()).isEqualTo(FailureCode.NOT_FOUND);
        assertThat(failure.status()).isEqualTo(404);
        assertThat(transport.calls()).isEqualTo(1);
        assertThat(reporter.retries).isEmpty();
        assertThat(client.breaker().consecutiveFailures()).isZero();
    }

    @Test
    void clientErrors_neverOpenBreaker() {
        ScriptedTransport transport = ScriptedTransport.statuses(429);
        ResilientHttpClient client = client(transport, config(2, 2));

        for (int i = 0; i < 5; i++) {
            assertThat(client.send(GET_ORDERS).findFailure().map(Failure::code)).contains(FailureCode.SERVICE_UNAVAILABLE);
        }

        assertThat(client.breaker().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(transport.calls()).isEqualTo(5);
    }

    @Test
    void success_returnsResponseUnmodifiedAndReportsCompletion() {
        ScriptedTransport transport = new ScriptedTransport().then(500, "").then(201, "{\"id\":1}");
        ResilientHttpClient client = client(transport, config(3, 3));

        HttpResponse<byte[]> response = client.send(GET_ORDERS).getOrThrow();

        assertThat(new String(response.body())).isEqualTo("{\"id\":1}");
        assertThat(reporter.completed).singleElement().satisfies(call -> {
            assertThat(call.method()).isEqualTo("GET");
            assertThat(call.target()).isEqualTo("http://svc.test/orders");
            assertThat(call.status()).isEqualTo(201);
            assertThat(call.attempts()).isEqualTo(2);
            assertThat(call.latency()).isEqualTo(Duration.ofMillis(10));
            assertThat(call.responseBytes()).isEqualTo(8);
        });
        assertThat(reporter.failures).isEmpty();
    }

    @Test
    void retryDelay_growsLinearly() {
        ScriptedTransport transport = ScriptedTransport.statuses(503, 503, 503, 200);
        ResilientHttpClient client = client(transport, config(3, 10));

        client.send(GET_ORDERS);

        assertThat(reporter.retries).extracting(RecordingOpReporter.RetryAttempt::delay)
                .containsExactly(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(30));
    }

    @Test
    void transportErrors_areRetriedAndSurfaceAsNetwork() {
        ScriptedTransport transport = new ScriptedTransport().thenThrow(new ConnectException("Connection refused"));
        ResilientHttpClient client = client(transport, config(2, 10));

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        Failure failure = result.findFailure().orElseThrow();
        assertThat(failure.type()).isEqualTo(FailureType.NETWORK);
        assertThat(failure.hasStatus()).isFalse();
        assertThat(failure.exception()).isInstanceOf(ConnectException.class);
        assertThat(failure.tags()).containsEntry("attempts", "3");
        assertThat(transport.calls()).isEqualTo(3);
        assertThat(reporter.failures).containsExactly(failure);
    }

    @Test
    void timeout_surfacesAsTimeout() {
        ScriptedTransport transport = new ScriptedTransport().thenThrow(new HttpTimeoutException("request timed out"));
        ResilientHttpClient client = client(transport, config(0, 10));

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        assertThat(result.findFailure().map(Failure::type)).contains(FailureType.TIMEOUT);
        assertThat(result.findFailure().map(Failure::code)).contains(FailureCode.TIMEOUT);
        assertThat(transport.calls()).isEqualTo(1);
    }

    @Test
    void eachAttemptIsBoundedByRemainingBudget() {
        ScriptedTransport transport = ScriptedTransport.statuses(500, 500, 200);
        ClientConfig config = ClientConfig.builder()
                .timeout(Duration.ofSeconds(2))
                .maxRetries(3)
                .retryDelay(Duration.ofMillis(500))
                .build();
        ResilientHttpClient client = client(transport, config);

        client.send(GET_ORDERS);

        assertThat(transport.requests()).extracting(r -> r.timeout().orElseThrow())
                .containsExactly(Duration.ofSeconds(2), Duration.ofMillis(1500), Duration.ofMillis(500));
    }

    @Test
    void retryThatWouldOverrunTimeout_givesUpWithLastFailure() {
        ScriptedTransport transport = ScriptedTransport.statuses(502);
        ClientConfig config = ClientConfig.builder()
                .timeout(Duration.ofSeconds(1))
                .maxRetries(5)
                .retryDelay(Duration.ofSeconds(1))
                .build();
        ResilientHttpClient client = client(transport, config);

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        assertThat(result.findFailure().map(Failure::status)).contains(502);
        assertThat(transport.calls()).isEqualTo(1);
        assertThat(reporter.exhausted).extracting(RecordingOpReporter.RetryExhausted::reason)
                .containsExactly("budget exhausted");
    }

    @Test
    void requestOwnShorterTimeout_isKept() {
        ScriptedTransport transport = ScriptedTransport.statuses(200);
        ResilientHttpClient client = client(transport, config(0, 10));
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://svc.test/orders"))
                .timeout(Duration.ofSeconds(3))
                .build();

        client.send(request);

        assertThat(transport.requests().get(0).timeout()).contains(Duration.ofSeconds(3));
    }

    @Test
    void correlationId_isSentOnEveryAttemptAndStampedOnFailure() {
        ScriptedTransport transport = ScriptedTransport.statuses(500);
        ResilientHttpClient client = ResilientHttpClient.builder()
                .config(config(2, 10))
                .transport(transport)
                .reporter(reporter)
                .correlationIdSupplier(() -> "req-77")
                .clock(clock)
                .sleeper(millis -> clock.advance(Duration.ofMillis(millis)))
                .build();

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        assertThat(transport.requests()).hasSize(3)
                .extracting(r -> r.headers().allValues(ResilientHttpClient.REQUEST_ID_HEADER))
                .containsOnly(List.of("req-77"));
        assertThat(result.findFailure().map(Failure::correlationId)).contains("req-77");
    }

    @Test
    void correlationId_defaultsToThreadContextAndReplacesCallerHeader() {
        ScriptedTransport transport = ScriptedTransport.statuses(200);
        ResilientHttpClient client = ResilientHttpClient.builder()
                .config(config(0, 10))
                .transport(transport)
                .reporter(reporter)
                .clock(clock)
                .build();
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://svc.test/orders"))
                .header("x-request-id", "stale")
                .header("Accept", "application/json")
                .build();

        CorrelationIds.withRequestId("ctx-1", () -> client.send(request));

        HttpRequest sent = transport.requests().get(0);
        assertThat(sent.headers().allValues(ResilientHttpClient.REQUEST_ID_HEADER)).containsExactly("ctx-1");
        assertThat(sent.headers().firstValue("Accept")).contains("application/json");
        assertThat(reporter.completed).singleElement().extracting(CallMetadata::correlationId).isEqualTo("ctx-1");
    }

    @Test
    void noCorrelationId_sendsNoHeader() {
        ScriptedTransport transport = ScriptedTransport.statuses(200);
        ResilientHttpClient client = client(transport, config(0, 10));

        client.send(GET_ORDERS);

        assertThat(transport.requests().get(0).headers().firstValue(ResilientHttpClient.REQUEST_ID_HEADER))
                .isEqualTo(Optional.empty());
    }

    @Test
    void noCorrelationId_keepsCallerHeader() {
        ScriptedTransport transport = ScriptedTransport.statuses(200);
        ResilientHttpClient client = client(transport, config(0, 10));
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://svc.test/orders"))
                .header(ResilientHttpClient.REQUEST_ID_HEADER, "caller-42")
                .build();

        client.send(request);

        assertThat(transport.requests().get(0).headers().allValues(ResilientHttpClient.REQUEST_ID_HEADER))
                .containsExactly("caller-42");
    }

    @Test
    void illegalCorrelationId_isDroppedWithoutTouchingBreaker() {
        ScriptedTransport transport = ScriptedTransport.statuses(404);
        ResilientHttpClient client = ResilientHttpClient.builder()
                .config(config(0, 1))
                .transport(transport)
                .reporter(reporter)
                .correlationIdSupplier(() -> "abc\r\nInjected: x")
                .clock(clock)
                .build();

        Outcome<HttpResponse<byte[]>> result = client.send(GET_ORDERS);

        assertThat(transport.calls()).isEqualTo(1);
        HttpRequest sent = transport.requests().get(0);
        assertThat(sent.headers().firstValue(ResilientHttpClient.REQUEST_ID_HEADER)).isEmpty();
        assertThat(sent.headers().firstValue("Injected")).isEmpty();
        assertThat(result.findFailure().map(Failure::type)).contains(FailureType.UPSTREAM_STATUS);
        assertThat(result.findFailure().orElseThrow().correlationId()).isNull();
        assertThat(client.breaker().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(client.breaker().consecutiveFailures()).isZero();
    }

    @Test
    void openBreaker_admitsTrialAfterOpenDuration() {
        ScriptedTransport transport = ScriptedTransport.statuses(500, 200);
        ClientConfig config = ClientConfig.builder()
                .maxRetries(0)
                .retryDelay(Duration.ofMillis(10))
                .failureThreshold(1)
                .openDuration(Duration.ofSeconds(30))
                .build();
        ResilientHttpClient client = client(transport, config);

        client.send(GET_ORDERS);
        assertThat(client.breaker().state()).isEqualTo(CircuitState.OPEN);

        clock.advance(Duration.ofSeconds(30));
        Outcome<HttpResponse<byte[]>> trial = client.send(GET_ORDERS);

        assertThat(trial.isOk()).isTrue();
        assertThat(client.breaker().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(reporter.stateChanges).extracting(RecordingOpReporter.StateChange::to)
                .containsExactly(CircuitState.OPEN, CircuitState.HALF_OPEN, CircuitState.CLOSED);
    }

    @Test
    void runtimeExceptionFromTransport_propagates() {
        ResilientHttpClient client = client(request -> {
            throw new IllegalArgumentException("unsupported scheme");
        }, config(3, 1));

        assertThatThrownBy(() -> client.send(GET_ORDERS)).isInstanceOf(IllegalArgumentException.class);
        assertThat(client.breaker().state()).isEqualTo(CircuitState.OPEN);
    }

    private ResilientHttpClient client(Transport transport, ClientConfig config) {
        return ResilientHttpClient.builder()
                .config(config)
                .transport(transport)
                .reporter(reporter)
                .correlationIdSupplier(CorrelationIds.none())
                .name("orders")
                .clock(clock)
                .sleeper(millis -> clock.advance(Duration.ofMillis(millis)))
                .build();
    }

    private static ClientConfig config(int maxRetries, int failureThreshold) {
        return ClientConfig.builder()
                .maxRetries(maxRetries)
                .retryDelay(Duration.ofMillis(10))
                .failureThreshold(failureThreshold)
                .build();
    }
}
