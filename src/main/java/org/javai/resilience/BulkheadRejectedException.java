package org.javai.resilience;

/**
 * Thrown when a bulkhead has no free slot and will not wait (or has waited long enough).
 * The work was never started.
 */
public class BulkheadRejectedException extends ResilienceException {

    private final int maxConcurrent;

    public BulkheadRejectedException(int maxConcurrent) {
        super("Bulkhead saturated: " + maxConcurrent + " concurrent call(s) already in flight");
        this.maxConcurrent = maxConcurrent;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.BULKHEAD_REJECTED;
    }
}
