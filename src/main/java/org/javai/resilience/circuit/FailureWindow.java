package org.javai.resilience.circuit;

import java.time.Duration;
import java.util.Objects;

/**
 * How a closed circuit counts failures towards its threshold.
 *
 * <ul>
 *   <li>{@link #consecutive()}: failures in a row. Any success resets the count.</li>
 *   <li>{@link #sliding(Duration)}: failures whose timestamps fall within the trailing window,
 *       regardless of successes in between.</li>
 * </ul>
 *
 * @param type the counting strategy
 * @param duration the window length for {@link Type#SLIDING}; null for {@link Type#CONSECUTIVE}
 */
public record FailureWindow(Type type, Duration duration) {

    private static final FailureWindow CONSECUTIVE = new FailureWindow(Type.CONSECUTIVE, null);

    public enum Type {
        CONSECUTIVE,
        SLIDING
    }

    public FailureWindow {
        Objects.requireNonNull(type, "type must not be null");
        if (type == Type.SLIDING) {
            Objects.requireNonNull(duration, "duration must not be null for a sliding window");
            if (duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException("duration must be positive, was: " + duration);
            }
        } else if (duration != null) {
            throw new IllegalArgumentException("a consecutive window has no duration");
        }
    }

    public static FailureWindow consecutive() {
        return CONSECUTIVE;
    }

    public static FailureWindow sliding(Duration duration) {
        return new FailureWindow(Type.SLIDING, duration);
    }

    public boolean isSliding() {
        return type == Type.SLIDING;
    }
}
