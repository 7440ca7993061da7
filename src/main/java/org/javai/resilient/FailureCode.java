package org.javai.resilient;

/**
 * Stable, machine-readable application error codes that failures map to.
 * Callers branch on these rather than on raw HTTP statuses.
 */
public enum FailureCode {
    /**
     * The request was malformed or rejected as invalid (400, 413, 422).
     */
    INVALID_ARGUMENT("Invalid input provided"),

    /**
     * The request requires authentication (401).
     */
    UNAUTHENTICATED("Authentication required"),

    /**
     * The caller lacks the necessary permissions (403).
     */
    PERMISSION_DENIED("Insufficient permissions"),

    /**
     * The requested resource does not exist (404).
     */
    NOT_FOUND("Resource not found"),

    /**
     * The request conflicts with the current state of the resource (409).
     */
    ALREADY_EXISTS("Resource already exists"),

    /**
     * Unexpected server-side error (500 and unlisted statuses).
     */
    INTERNAL_ERROR("Internal server error"),

    /**
     * The upstream does not support the requested method (405).
     */
    NOT_IMPLEMENTED("Feature not implemented"),

    /**
     * The upstream is temporarily unable to serve (429, 503, open breaker, network).
     */
    SERVICE_UNAVAILABLE("Service temporarily unavailable"),

    /**
     * The call ran out of time (408, 504, transport timeouts).
     */
    TIMEOUT("Request timeout");

    private final String description;

    FailureCode(String description) {
        this.description = description;
    }

    /**
     * Returns a human-readable description of the code.
     */
    public String description() {
        return description;
    }
}
