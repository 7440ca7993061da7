package org.javai.resilient.client;

import org.apache.logging.log4j.ThreadContext;

import java.util.function.Supplier;

/**
 * Sources of the request id forwarded to the upstream.
 *
 * <p>The default source is the Log4j2 {@link ThreadContext}: whatever put {@code request_id}
 * there for the current request (a servlet filter, a message listener) also gets it
 * propagated on outbound calls, and into the log lines of the call.</p>
 */
public final class CorrelationIds {

    /**
     * ThreadContext key holding the current request id.
     */
    public static final String THREAD_CONTEXT_KEY = "request_id";

    private CorrelationIds() {
    }

    /**
     * Reads the request id from the calling thread's Log4j2 ThreadContext. Blank ids are absent.
     */
    public static Supplier<String> fromThreadContext() {
        return () -> {
            String id = ThreadContext.get(THREAD_CONTEXT_KEY);
            return id == null || id.isBlank() ? null : id;
        };
    }

    /**
     * A source that never supplies an id.
     */
    public static Supplier<String> none() {
        return () -> null;
    }

    /**
     * Runs {@code work} with {@code requestId} bound in the ThreadContext, restoring the
     * previous binding afterwards.
     */
    public static <T> T withRequestId(String requestId, Supplier<T> work) {
        String previous = ThreadContext.get(THREAD_CONTEXT_KEY);
        ThreadContext.put(THREAD_CONTEXT_KEY, requestId);
        try {
            return work.get();
        } finally {
            if (previous == null) {
                ThreadContext.remove(THREAD_CONTEXT_KEY);
            } else {
                ThreadContext.put(THREAD_CONTEXT_KEY, previous);
            }
        }
    }
}
