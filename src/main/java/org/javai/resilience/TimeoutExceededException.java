package org.javai.resilience;

import java.time.Duration;

/**
 * Thrown when work does not complete within a timeout policy's deadline.
 *
 * <p>Receiving this exception does not mean the work has stopped. See
 * {@link org.javai.resilience.timeout.TimeoutPolicy} for what happens to the abandoned worker.</p>
 */
public class TimeoutExceededException extends ResilienceException {

    private final Duration timeout;

    public TimeoutExceededException(Duration timeout) {
        super("Timeout after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TIMEOUT;
    }
}
