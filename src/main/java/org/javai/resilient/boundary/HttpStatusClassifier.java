package org.javai.resilient.boundary;

import org.javai.resilient.Failure;
import org.javai.resilient.FailureCode;

/**
 * Maps HTTP statuses to application error codes.
 *
 * <table>
 *   <caption>Status mapping</caption>
 *   <tr><th>Status</th><th>Code</th></tr>
 *   <tr><td>400, 413, 422</td><td>{@link FailureCode#INVALID_ARGUMENT}</td></tr>
 *   <tr><td>401</td><td>{@link FailureCode#UNAUTHENTICATED}</td></tr>
 *   <tr><td>403</td><td>{@link FailureCode#PERMISSION_DENIED}</td></tr>
 *   <tr><td>404</td><td>{@link FailureCode#NOT_FOUND}</td></tr>
 *   <tr><td>405</td><td>{@link FailureCode#NOT_IMPLEMENTED}</td></tr>
 *   <tr><td>408, 504</td><td>{@link FailureCode#TIMEOUT}</td></tr>
 *   <tr><td>409</td><td>{@link FailureCode#ALREADY_EXISTS}</td></tr>
 *   <tr><td>429, 503</td><td>{@link FailureCode#SERVICE_UNAVAILABLE}</td></tr>
 *   <tr><td>500, other 5xx, other 4xx</td><td>{@link FailureCode#INTERNAL_ERROR}</td></tr>
 * </table>
 */
public final class HttpStatusClassifier {

    private HttpStatusClassifier() {
    }

    /**
     * Returns the application error code for an error status.
     *
     * @param status an HTTP status, expected to be {@code >= 400}
     */
    public static FailureCode codeFor(int status) {
        return switch (status) {
            case 400, 413, 422 -> FailureCode.INVALID_ARGUMENT;
            case 401 -> FailureCode.UNAUTHENTICATED;
            case 403 -> FailureCode.PERMISSION_DENIED;
            case 404 -> FailureCode.NOT_FOUND;
            case 405 -> FailureCode.NOT_IMPLEMENTED;
            case 408, 504 -> FailureCode.TIMEOUT;
            case 409 -> FailureCode.ALREADY_EXISTS;
            case 429, 503 -> FailureCode.SERVICE_UNAVAILABLE;
            default -> FailureCode.INTERNAL_ERROR;
        };
    }

    /**
     * Returns true for statuses the client treats as an upstream error.
     */
    public static boolean isError(int status) {
        return status >= 400;
    }

    /**
     * Returns true for 2xx statuses.
     */
    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    /**
     * Returns true for statuses where another attempt may succeed (5xx).
     */
    public static boolean isRetryable(int status) {
        return status >= 500;
    }

    /**
     * Creates an {@code UPSTREAM_STATUS} failure for the given status.
     */
    public static Failure toFailure(String operation, int status) {
        return Failure.upstreamStatus(operation, status, codeFor(status));
    }
}
