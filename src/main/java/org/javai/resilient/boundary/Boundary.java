package org.javai.resilient.boundary;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.resilient.Failure;
import org.javai.resilient.Outcome;

/**
 * Translates a blocking transport call that throws checked exceptions into an {@link Outcome}.
 *
 * <p>This is the single point where transport exceptions are classified. After passing
 * through a Boundary, the retry loop and the circuit breaker operate entirely on outcomes.</p>
 *
 * <p>RuntimeExceptions (defects such as a malformed URI) are not caught and propagate
 * to the caller unclassified.</p>
 *
 * <pre>{@code
 * Boundary boundary = Boundary.of(new TransportFailureClassifier(), CorrelationIds.fromThreadContext());
 *
 * Outcome<HttpResponse<byte[]>> result = boundary.call(
 *     "GET https://api.example.com/users",
 *     () -> transport.send(request)
 * );
 * }</pre>
 */
public final class Boundary {

    private static final FailureClassifier DEFAULT_CLASSIFIER = new TransportFailureClassifier();

    private final FailureClassifier classifier;
    private final Supplier<String> correlationIdSupplier;

    /**
     * Creates a Boundary with transport classification and no correlation id.
     */
    public static Boundary transport() {
        return new Boundary(DEFAULT_CLASSIFIER, () -> null);
    }

    /**
     * Creates a Boundary with a custom classifier and correlation id source.
     *
     * @param classifier the classifier for translating exceptions to failures
     * @param correlationIdSupplier supplies the request id stamped on failures (may return null)
     */
    public static Boundary of(FailureClassifier classifier, Supplier<String> correlationIdSupplier) {
        return new Boundary(classifier, correlationIdSupplier);
    }

    public Boundary(FailureClassifier classifier, Supplier<String> correlationIdSupplier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier, "correlationIdSupplier must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, Map.of(), work);
    }

    /**
     * Executes work with additional tags attached to any failure.
     *
     * @param operation The operation name
     * @param tags Additional metadata tags
     * @param work The work to execute
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, Map<String, String> tags, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, tags, e);
        }
    }

    private <T> Outcome<T> handleException(String operation, Map<String, String> tags, Exception e) {
        Failure failure = classifier.classify(operation, e)
                .withContext(correlationIdSupplier.get(), tags);
        return Outcome.fail(failure);
    }
}
