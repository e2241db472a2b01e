package org.javai.resilience.circuit;

/**
 * States of a {@link CircuitBreaker}.
 *
 * <pre>
 *     CLOSED ──(failures reach threshold)──> OPEN
 *        ^                                     │
 *        │                             (reset timeout elapsed,
 *  (success threshold                    next call arrives)
 *     reached)                                 │
 *        │                                     v
 *        └──────────────── HALF_OPEN ──(any failure)──> OPEN
 * </pre>
 */
public enum CircuitState {

    /**
     * Calls pass through; failures are counted.
     */
    CLOSED,

    /**
     * Calls are rejected without reaching the protected dependency.
     */
    OPEN,

    /**
     * A bounded number of trial calls probe whether the dependency has recovered.
     */
    HALF_OPEN
}
