package org.javai.resilience.bulkhead;

/**
 * What a saturated bulkhead does with a new caller.
 */
public enum QueuePolicy {

    /**
     * Wait for a slot, up to the bulkhead's max wait when one is configured.
     */
    BLOCK,

    /**
     * Fail immediately with {@link org.javai.resilience.BulkheadRejectedException}.
     */
    REJECT
}
