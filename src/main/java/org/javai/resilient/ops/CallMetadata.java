package org.javai.resilient.ops;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata of a call that received a response.
 *
 * @param method HTTP method
 * @param target Request URI
 * @param status Status of the final response
 * @param latency Time from the first attempt to the final response
 * @param attempts Number of attempts made
 * @param correlationId Request id sent upstream (may be null)
 * @param responseHeaders Headers of the final response
 * @param responseBytes Size of the final response body, or -1 if unknown
 */
public record CallMetadata(
        String method,
        String target,
        int status,
        Duration latency,
        int attempts,
        String correlationId,
        Map<String, List<String>> responseHeaders,
        long responseBytes
) {

    public CallMetadata {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(latency, "latency must not be null");
        responseHeaders = responseHeaders == null ? Map.of() : Map.copyOf(responseHeaders);
    }

    /**
     * Metadata without response details.
     */
    public CallMetadata(String method, String target, int status, Duration latency, int attempts, String correlationId) {
        this(method, target, status, latency, attempts, correlationId, Map.of(), -1);
    }
}
