package org.javai.resilient.client;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.javai.resilient.Failure;
import org.javai.resilient.Outcome;
import org.javai.resilient.boundary.Boundary;
import org.javai.resilient.boundary.HttpStatusClassifier;
import org.javai.resilient.boundary.TransportFailureClassifier;
import org.javai.resilient.breaker.CircuitBreaker;
import org.javai.resilient.ops.CallMetadata;
import org.javai.resilient.ops.OpReporter;
import org.javai.resilient.retry.Retrier;
import org.javai.resilient.retry.RetryContext;
import org.javai.resilient.retry.RetryPolicy;

/**
 * An {@link UpstreamClient} that retries transient failures and circuit-breaks a failing
 * upstream.
 *
 * <p>Composition, outermost first:</p>
 * <pre>
 *     CircuitBreaker.execute
 *         Retrier.executeWithContext
 *             Boundary.call(transport.send)
 * </pre>
 *
 * <p>The breaker sees one result per call, after retries: a call that recovers on a later
 * attempt counts as a success, a call that exhausts its attempts counts as one failure.
 * A 4xx answer is never retried and leaves the breaker untouched; it is mapped to an
 * {@code UPSTREAM_STATUS} failure after the breaker.</p>
 *
 * <p>The request id, when the supplier provides one, is set as {@value #REQUEST_ID_HEADER} on
 * every attempt and stamped on every returned failure.</p>
 *
 * <pre>{@code
 * ResilientHttpClient client = ResilientHttpClient.builder()
 *     .config(ClientConfig.fromEnvironment())
 *     .reporter(new Log4jOpReporter())
 *     .name("billing")
 *     .build();
 *
 * Outcome<HttpResponse<byte[]>> outcome = client.send(request);
 * }</pre>
 *
 * <p>Instances are thread-safe; share one per upstream.</p>
 */
public final class ResilientHttpClient implements UpstreamClient {

    /**
     * Header carrying the request id on outbound attempts.
     */
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final ClientConfig config;
    private final Transport transport;
    private final OpReporter reporter;
    private final Supplier<String> correlationIdSupplier;
    private final Clock clock;
    private final TransportFailureClassifier classifier = new TransportFailureClassifier();
    private final CircuitBreaker breaker;
    private final Retrier retrier;

    private ResilientHttpClient(Builder builder) {
        this.config = builder.config;
        this.transport = builder.transport != null
                ? builder.transport
                : JdkHttpTransport.create(config.dialTimeout());
        this.reporter = builder.reporter;
        this.correlationIdSupplier = builder.correlationIdSupplier;
        this.clock = builder.clock;
        this.breaker = CircuitBreaker.builder(builder.name)
                .failureThreshold(config.failureThreshold())
                .openDuration(config.openDuration())
                .halfOpenMaxCalls(config.halfOpenMaxCalls())
                .reporter(reporter)
                .clock(clock)
                .build();
        this.retrier = Retrier.builder()
                .policy(RetryPolicy.linearBackoff(builder.name, config.maxAttempts(), config.retryDelay()))
                .budget(config.timeout())
                .reporter(reporter)
                .sleeper(builder.sleeper)
                .clock(clock)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a client with the given configuration, the JDK transport and no reporting.
     */
    public static ResilientHttpClient create(ClientConfig config) {
        return builder().config(config).build();
    }

    @Override
    public Outcome<HttpResponse<byte[]>> send(HttpRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        String operation = request.method() + " " + request.uri();
        String requestedId = correlationIdSupplier.get();
        HttpRequest prepared = withRequestId(request, requestedId);
        // An id that is not a legal header value is neither sent nor stamped.
        String correlationId = prepared != null ? requestedId : null;
        HttpRequest outbound = prepared != null ? prepared : request;
        AtomicInteger attempts = new AtomicInteger();
        Instant start = clock.instant();

        Outcome<HttpResponse<byte[]>> result = breaker.execute(operation,
                () -> retrier.executeWithContext(operation,
                        context -> attempt(outbound, operation, correlationId, context, attempts.incrementAndGet())));

        Map<String, String> tags = Map.of("attempts", String.valueOf(attempts.get()));

        if (result instanceof Outcome.Fail<HttpResponse<byte[]>> fail) {
            Failure failure = fail.failure().withContext(correlationId, tags);
            reporter.report(failure);
            return Outcome.fail(failure);
        }

        HttpResponse<byte[]> response = result.getOrThrow();
        int status = response.statusCode();
        reporter.reportCompleted(new CallMetadata(
                request.method(),
                request.uri().toString(),
                status,
                Duration.between(start, clock.instant()),
                attempts.get(),
                correlationId,
                response.headers().map(),
                response.body() == null ? 0 : response.body().length));

        if (HttpStatusClassifier.isError(status)) {
            Failure failure = HttpStatusClassifier.toFailure(operation, status).withContext(correlationId, tags);
            reporter.report(failure);
            return Outcome.fail(failure);
        }
        return result;
    }

    /**
     * The breaker guarding this client's upstream.
     */
    public CircuitBreaker breaker() {
        return breaker;
    }

    public ClientConfig config() {
        return config;
    }

    /**
     * Where this client reads the request id from.
     */
    public Supplier<String> correlationIdSupplier() {
        return correlationIdSupplier;
    }

    private Outcome<HttpResponse<byte[]>> attempt(HttpRequest request, String operation, String correlationId,
                                                  RetryContext context, int attemptNumber) {
        Duration remaining = context.remainingBudget();
        if (remaining != null && remaining.isZero()) {
            return Outcome.fail(Failure.timeout(operation,
                    "Overall timeout of " + config.timeout().toMillis() + "ms elapsed before attempt " + attemptNumber,
                    null).withContext(correlationId, Map.of()));
        }

        HttpRequest outbound = withAttemptTimeout(request, remaining);
        return Boundary.of(classifier, () -> correlationId).call(operation, () -> transport.send(outbound))
                .flatMap(response -> retryableStatus(operation, correlationId, response));
    }

    private static Outcome<HttpResponse<byte[]>> retryableStatus(String operation, String correlationId,
                                                                 HttpResponse<byte[]> response) {
        int status = response.statusCode();
        if (HttpStatusClassifier.isRetryable(status)) {
            return Outcome.fail(HttpStatusClassifier.toFailure(operation, status)
                    .withContext(correlationId, Map.of()));
        }
        return Outcome.ok(response);
    }

    /**
     * Returns the request carrying {@code correlationId} as {@value #REQUEST_ID_HEADER}, the
     * request itself when there is no id, or {@code null} when the id is not a legal header value.
     */
    private static HttpRequest withRequestId(HttpRequest request, String correlationId) {
        if (correlationId == null) {
            return request;
        }
        try {
            return HttpRequest.newBuilder(request, (name, value) -> !name.equalsIgnoreCase(REQUEST_ID_HEADER))
                    .header(REQUEST_ID_HEADER, correlationId)
                    .build();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static HttpRequest withAttemptTimeout(HttpRequest request, Duration remaining) {
        if (remaining == null) {
            return request;
        }
        Duration own = request.timeout().orElse(null);
        return HttpRequest.newBuilder(request, (name, value) -> true)
                .timeout(own != null && own.compareTo(remaining) < 0 ? own : remaining)
                .build();
    }

    public static final class Builder {
        private ClientConfig config = ClientConfig.defaults();
        private Transport transport;
        private OpReporter reporter = OpReporter.noOp();
        private Supplier<String> correlationIdSupplier = CorrelationIds.fromThreadContext();
        private String name = "http-client";
        private Clock clock = Clock.systemUTC();
        private Retrier.Sleeper sleeper = Thread::sleep;

        private Builder() {}

        public Builder config(ClientConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the transport (optional, defaults to {@link JdkHttpTransport} with the
         * configured dial timeout).
         */
        public Builder transport(Transport transport) {
            this.transport = Objects.requireNonNull(transport, "transport must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets where the request id comes from (optional, defaults to the Log4j2 ThreadContext).
         */
        public Builder correlationIdSupplier(Supplier<String> correlationIdSupplier) {
            this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier,
                    "correlationIdSupplier must not be null");
            return this;
        }

        /**
         * Names the upstream; used as the breaker name and the retry policy id.
         */
        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder sleeper(Retrier.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public ResilientHttpClient build() {
            return new ResilientHttpClient(this);
        }
    }
}
