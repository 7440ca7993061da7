package org.javai.resilient.boundary;

import org.javai.resilient.Failure;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies exceptions raised by a transport that produced no response.
 *
 * <p>Anything that ran out of time is a {@code TIMEOUT}; every other transport exception
 * (refused connection, unknown host, reset, interrupted call) is a {@code NETWORK} failure.
 * Both are retryable.</p>
 */
public class TransportFailureClassifier implements FailureClassifier {

    @Override
    public Failure classify(String operation, Throwable t) {
        // HttpConnectTimeoutException extends HttpTimeoutException
        if (t instanceof HttpTimeoutException) {
            return Failure.timeout(operation, messageFor("HTTP timeout", t), t);
        }

        if (t instanceof SocketTimeoutException) {
            return Failure.timeout(operation, messageFor("Socket timeout", t), t);
        }

        if (t instanceof TimeoutException) {
            return Failure.timeout(operation, messageFor("Operation timeout", t), t);
        }

        if (t instanceof ConnectException) {
            return Failure.network(operation, messageFor("Connection refused", t), t);
        }

        if (t instanceof UnknownHostException) {
            return Failure.network(operation, messageFor("Unknown host", t), t);
        }

        if (t instanceof InterruptedException || t instanceof InterruptedIOException) {
            return Failure.network(operation, messageFor("Call interrupted", t), t);
        }

        if (t instanceof ClosedChannelException) {
            return Failure.network(operation, messageFor("Connection closed", t), t);
        }

        return Failure.network(operation, messageFor("Network error", t), t);
    }

    private static String messageFor(String prefix, Throwable t) {
        String detail = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return prefix + ": " + detail;
    }
}
