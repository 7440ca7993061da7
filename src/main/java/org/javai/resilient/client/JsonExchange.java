package org.javai.resilient.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.resilient.Failure;
import org.javai.resilient.Outcome;
import org.javai.resilient.boundary.Boundary;
import org.javai.resilient.boundary.HttpStatusClassifier;

/**
 * Sends a request through an {@link UpstreamClient} and binds the JSON body to a typed value.
 *
 * <p>A failure from the client passes through unchanged. A response outside 2xx becomes an
 * {@code UPSTREAM_STATUS} failure. A body that cannot be bound, or binds to {@code null},
 * becomes a {@code DECODE_FAILURE}, distinct from any upstream failure. Both carry the
 * request id, read from the client's supplier when the client is a
 * {@link ResilientHttpClient} and from the Log4j2 ThreadContext otherwise.</p>
 *
 * <pre>{@code
 * JsonExchange json = new JsonExchange(client);
 *
 * Outcome<User> user = json.fetch(request, User.class);
 * Outcome<List<User>> users = json.fetch(request, new TypeReference<List<User>>() {});
 * }</pre>
 */
public final class JsonExchange {

    private final UpstreamClient client;
    private final ObjectMapper mapper;
    private final Supplier<String> correlationIdSupplier;

    /**
     * Creates an exchange with a mapper that ignores unknown properties.
     */
    public JsonExchange(UpstreamClient client) {
        this(client, new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public JsonExchange(UpstreamClient client, ObjectMapper mapper) {
        this(client, mapper, client instanceof ResilientHttpClient resilient
                ? resilient.correlationIdSupplier()
                : CorrelationIds.fromThreadContext());
    }

    public JsonExchange(UpstreamClient client, ObjectMapper mapper, Supplier<String> correlationIdSupplier) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier,
                "correlationIdSupplier must not be null");
    }

    public <T> Outcome<T> fetch(HttpRequest request, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return fetch(request, mapper.constructType(type));
    }

    public <T> Outcome<T> fetch(HttpRequest request, TypeReference<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        return fetch(request, mapper.constructType(type));
    }

    private <T> Outcome<T> fetch(HttpRequest request, JavaType type) {
        Objects.requireNonNull(request, "request must not be null");
        String operation = request.method() + " " + request.uri();
        return client.send(request).flatMap(response -> this.<T>decode(operation, response, type));
    }

    private <T> Outcome<T> decode(String operation, HttpResponse<byte[]> response, JavaType type) {
        int status = response.statusCode();
        if (!HttpStatusClassifier.isSuccess(status)) {
            return Outcome.fail(HttpStatusClassifier.toFailure(operation, status)
                    .withContext(correlationIdSupplier.get(), Map.of()));
        }

        Boundary decoding = Boundary.of(
                (op, e) -> Failure.decodeFailure(op, status,
                        "Could not decode response body as " + type.toCanonical() + ": " + e.getMessage(), e),
                correlationIdSupplier);

        byte[] body = response.body() == null ? new byte[0] : response.body();
        Outcome<T> decoded = decoding.call(operation, () -> mapper.<T>readValue(body, type));
        if (decoded.isOk() && decoded.getOrThrow() == null) {
            return Outcome.fail(Failure.decodeFailure(operation, status,
                    "Response body decoded to null as " + type.toCanonical(), null)
                    .withContext(correlationIdSupplier.get(), Map.of()));
        }
        return decoded;
    }
}
