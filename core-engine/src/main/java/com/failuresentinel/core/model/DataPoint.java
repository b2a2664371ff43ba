package com.failuresentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An anomalous reading inside a {@link DetectedPattern}.
 *
 * <p>
 * {@code severityScore} is the absolute z-score of the reading against its
 * baseline and is never negative. {@code expectedValue} is the baseline the
 * reading was compared with, expressed in the sensor's own units.
 * </p>
 *
 * @since 1.0.0
 */
public final class DataPoint {

    private final Instant timestamp;
    private final double value;
    private final double expectedValue;
    private final double severityScore;

    /**
     * @throws IllegalArgumentException if {@code severityScore} is negative or
     *                                  not a number
     */
    public DataPoint(Instant timestamp, double value, double expectedValue, double severityScore) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!(severityScore >= 0)) {
            throw new IllegalArgumentException("severityScore must be >= 0, got: " + severityScore);
        }
        this.value = value;
        this.expectedValue = expectedValue;
        this.severityScore = severityScore;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getSeverityScore() {
        return severityScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(expectedValue, that.expectedValue) == 0
                && Double.compare(severityScore, that.severityScore) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, expectedValue, severityScore);
    }

    @Override
    public String toString() {
        return "DataPoint{" + timestamp + ", value=" + value
                + ", expected=" + expectedValue + ", severityScore=" + severityScore + '}';
    }
}
