package com.failuresentinel.core.correlation;

import java.time.Duration;
import java.util.Objects;

/**
 * Best-aligning lag between two patterns.
 *
 * <p>
 * A positive lag means pattern B follows pattern A by {@code lag} grid steps
 * ({@link #getLagDuration()} in wall time).
 * </p>
 *
 * @since 1.0.0
 */
public final class TemporalCorrelation {

    private final String patternIdA;
    private final String patternIdB;
    private final int lag;
    private final Duration lagDuration;
    private final double correlation;

    public TemporalCorrelation(String patternIdA, String patternIdB, int lag, Duration lagDuration,
            double correlation) {
        this.patternIdA = Objects.requireNonNull(patternIdA, "patternIdA must not be null");
        this.patternIdB = Objects.requireNonNull(patternIdB, "patternIdB must not be null");
        this.lagDuration = Objects.requireNonNull(lagDuration, "lagDuration must not be null");
        this.lag = lag;
        this.correlation = correlation;
    }

    public String getPatternIdA() {
        return patternIdA;
    }

    public String getPatternIdB() {
        return patternIdB;
    }

    public int getLag() {
        return lag;
    }

    public Duration getLagDuration() {
        return lagDuration;
    }

    public double getCorrelation() {
        return correlation;
    }

    @Override
    public String toString() {
        return "TemporalCorrelation{" + patternIdA + " -> " + patternIdB
                + ", lag=" + lag + " (" + lagDuration + "), r=" + correlation + '}';
    }
}
