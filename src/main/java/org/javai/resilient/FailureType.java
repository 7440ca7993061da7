package org.javai.resilient;

/**
 * Tags why an outbound call failed.
 */
public enum FailureType {
    /**
     * The circuit breaker rejected the call. The transport was never contacted.
     */
    BREAKER_OPEN,

    /**
     * The transport gave up waiting: connect timeout, request timeout, or the
     * overall call budget elapsed.
     */
    TIMEOUT,

    /**
     * The transport failed without a response (connection refused, reset, DNS failure).
     */
    NETWORK,

    /**
     * The upstream answered with an error status. The status is carried on the failure.
     */
    UPSTREAM_STATUS,

    /**
     * A response arrived but its body could not be read into the requested shape.
     */
    DECODE_FAILURE
}
