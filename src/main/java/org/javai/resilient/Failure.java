package org.javai.resilient;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A categorized failure of an outbound call, ready for reporting and for the caller to act on.
 *
 * @param type Why the call failed (breaker, timeout, network, upstream status, decode)
 * @param code The application error code the failure maps to
 * @param message Human-readable description
 * @param status The HTTP status of the final response (null when no response was received)
 * @param exception The underlying exception (may be null)
 * @param operation The call that failed, e.g. "GET https://api.example.com/users"
 * @param occurredAt When the failure happened
 * @param correlationId Request identifier propagated to the upstream (may be null)
 * @param tags Additional key-value metadata for observability
 */
public record Failure(
        FailureType type,
        FailureCode code,
        String message,
        Integer status,
        Throwable exception,
        String operation,
        Instant occurredAt,
        String correlationId,
        Map<String, String> tags
) {

    public Failure {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    // === Factory methods for each failure type ===

    /**
     * Creates a failure for a call rejected by an open circuit breaker.
     */
    public static Failure breakerOpen(String operation, String breakerName) {
        return builder(FailureType.BREAKER_OPEN, FailureCode.SERVICE_UNAVAILABLE,
                "Circuit breaker [" + breakerName + "] is open", operation)
                .tags(Map.of("breaker", breakerName))
                .build();
    }

    /**
     * Creates a failure for a transport call that timed out.
     */
    public static Failure timeout(String operation, String message, Throwable exception) {
        return builder(FailureType.TIMEOUT, FailureCode.TIMEOUT, message, operation)
                .exception(exception)
                .build();
    }

    /**
     * Creates a failure for a transport call that ended without a response.
     */
    public static Failure network(String operation, String message, Throwable exception) {
        return builder(FailureType.NETWORK, FailureCode.SERVICE_UNAVAILABLE, message, operation)
                .exception(exception)
                .build();
    }

    /**
     * Creates a failure for an error status answered by the upstream.
     */
    public static Failure upstreamStatus(String operation, int status, FailureCode code) {
        return builder(FailureType.UPSTREAM_STATUS, code, "Upstream responded with status " + status, operation)
                .status(status)
                .build();
    }

    /**
     * Creates a failure for a response body that could not be decoded.
     */
    public static Failure decodeFailure(String operation, int status, String message, Throwable exception) {
        return builder(FailureType.DECODE_FAILURE, FailureCode.INTERNAL_ERROR, message, operation)
                .status(status)
                .exception(exception)
                .build();
    }

    /**
     * Creates a builder for constructing Failures with full context.
     */
    public static Builder builder(FailureType type, FailureCode code, String message, String operation) {
        return new Builder(type, code, message, operation);
    }

    /**
     * Whether another attempt may succeed: transport errors and 5xx answers are transient,
     * everything else is terminal.
     */
    public boolean isRetryable() {
        return switch (type) {
            case NETWORK, TIMEOUT -> true;
            case UPSTREAM_STATUS -> status != null && status >= 500;
            case BREAKER_OPEN, DECODE_FAILURE -> false;
        };
    }

    /**
     * Returns true if the failure carries the status of a received response.
     */
    public boolean hasStatus() {
        return status != null;
    }

    /**
     * Returns a new Failure with the specified correlationId and tags added.
     */
    public Failure withContext(String correlationId, Map<String, String> tags) {
        Map<String, String> merged = new HashMap<>(this.tags);
        if (tags != null) {
            merged.putAll(tags);
        }
        return new Failure(type, code, message, status, exception, operation,
                occurredAt, correlationId, merged);
    }

    public static class Builder {
        private final FailureType type;
        private final FailureCode code;
        private final String message;
        private final String operation;
        private Integer status;
        private Throwable exception;
        private Instant occurredAt = Instant.now();
        private String correlationId;
        private Map<String, String> tags;

        private Builder(FailureType type, FailureCode code, String message, String operation) {
            this.type = Objects.requireNonNull(type);
            this.code = Objects.requireNonNull(code);
            this.message = Objects.requireNonNull(message);
            this.operation = Objects.requireNonNull(operation);
        }

        public Builder status(Integer status) {
            this.status = status;
            return this;
        }

        public Builder exception(Throwable exception) {
            this.exception = exception;
            return this;
        }

        public Builder occurredAt(Instant instant) {
            this.occurredAt = instant;
            return this;
        }

        public Builder correlationId(String id) {
            this.correlationId = id;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags;
            return this;
        }

        public Failure build() {
            return new Failure(type, code, message, status, exception, operation,
                    occurredAt, correlationId, tags);
        }
    }
}
