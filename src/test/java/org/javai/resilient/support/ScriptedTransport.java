package org.javai.resilient.support;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.javai.resilient.client.Transport;

/**
 * A transport that answers from a script of statuses and exceptions, then repeats the last
 * step. Records every request it receives.
 */
public final class ScriptedTransport implements Transport {

    private final Deque<Step> script = new ArrayDeque<>();
    private Step last = respond(200, "");
    private final List<HttpRequest> requests = new CopyOnWriteArrayList<>();

    public static ScriptedTransport statuses(int... statuses) {
        ScriptedTransport transport = new ScriptedTransport();
        for (int status : statuses) {
            transport.then(status, "");
        }
        return transport;
    }

    public ScriptedTransport then(int status, String body) {
        return then(respond(status, body));
    }

    public ScriptedTransport thenThrow(IOException e) {
        return then(request -> {
            throw e;
        });
    }

    public synchronized ScriptedTransport then(Step step) {
        script.add(step);
        return this;
    }

    @Override
    public HttpResponse<byte[]> send(HttpRequest request) throws IOException, InterruptedException {
        requests.add(request);
        Step step;
        synchronized (this) {
            if (!script.isEmpty()) {
                last = script.poll();
            }
            step = last;
        }
        return step.answer(request);
    }

    public int calls() {
        return requests.size();
    }

    public List<HttpRequest> requests() {
        return requests;
    }

    private static Step respond(int status, String body) {
        return request -> new StubResponse(request, status, body);
    }

    @FunctionalInterface
    public interface Step {
        HttpResponse<byte[]> answer(HttpRequest request) throws IOException, InterruptedException;
    }
}
