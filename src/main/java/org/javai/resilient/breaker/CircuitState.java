package org.javai.resilient.breaker;

/**
 * The states of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /**
     * Initial state. Calls pass through; consecutive failures are counted.
     */
    CLOSED,

    /**
     * Tripped. Calls are rejected without reaching the transport until the open duration elapses.
     */
    OPEN,

    /**
     * Probing. A limited number of trial calls are admitted; all others are rejected
     * while the trials are outstanding.
     */
    HALF_OPEN
}
