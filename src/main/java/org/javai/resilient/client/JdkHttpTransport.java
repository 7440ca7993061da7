package org.javai.resilient.client;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link Transport} backed by the JDK {@link HttpClient}.
 *
 * <p>The dial timeout bounds connection establishment only; the time spent waiting for a
 * response is bounded by each request's own timeout.</p>
 */
public final class JdkHttpTransport implements Transport {

    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    /**
     * Creates a transport whose connections time out after {@code dialTimeout}.
     */
    public static JdkHttpTransport create(Duration dialTimeout) {
        Objects.requireNonNull(dialTimeout, "dialTimeout must not be null");
        return new JdkHttpTransport(HttpClient.newBuilder()
                .connectTimeout(dialTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    @Override
    public HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }
}
