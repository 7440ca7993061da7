package org.javai.resilient.client;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.javai.resilient.Outcome;

/**
 * Sends requests to a single logical upstream.
 *
 * <p>Returns either the response or exactly one categorized failure; transport exceptions
 * never escape.</p>
 */
@FunctionalInterface
public interface UpstreamClient {

    /**
     * Sends a request, retrying and circuit breaking as configured.
     *
     * @param request the request to send
     * @return Ok with a response whose status is below 400, or Fail with the categorized failure
     */
    Outcome<HttpResponse<byte[]>> send(HttpRequest request);
}
