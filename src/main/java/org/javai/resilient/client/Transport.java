package org.javai.resilient.client;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Performs exactly one request against the upstream. No retries, no breaker.
 *
 * <p>Implementations block until a response arrives, the request's own timeout elapses
 * ({@link java.net.http.HttpTimeoutException}), or the transport fails ({@link IOException}).</p>
 */
@FunctionalInterface
public interface Transport {

    HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException;
}
