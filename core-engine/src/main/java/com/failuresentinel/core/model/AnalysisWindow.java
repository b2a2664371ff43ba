package com.failuresentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Time range and baseline resolution of one detection run.
 *
 * @since 1.0.0
 */
public final class AnalysisWindow {

    private final Instant startTime;
    private final Instant endTime;
    private final Granularity granularity;

    /**
     * @param startTime   inclusive start of the window
     * @param endTime     inclusive end of the window
     * @param granularity seasonal bucket resolution
     * @throws NullPointerException     if any argument is {@code null}
     * @throws IllegalArgumentException if {@code startTime} is not before
     *                                  {@code endTime}
     */
    public AnalysisWindow(Instant startTime, Instant endTime, Granularity granularity) {
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.endTime = Objects.requireNonNull(endTime, "endTime must not be null");
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
        if (!startTime.isBefore(endTime)) {
            throw new IllegalArgumentException(
                    "startTime must be before endTime, got: " + startTime + " >= " + endTime);
        }
    }

    public static AnalysisWindow hourly(Instant startTime, Instant endTime) {
        return new AnalysisWindow(startTime, endTime, Granularity.HOUR);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * Narrow the window so it spans at most {@code lookback} before its end.
     *
     * @param lookback maximum span to keep
     * @return effective inclusive start instant
     */
    public Instant effectiveStart(Duration lookback) {
        Instant lookbackStart = endTime.minus(lookback);
        return lookbackStart.isAfter(startTime) ? lookbackStart : startTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisWindow that))
            return false;
        return startTime.equals(that.startTime)
                && endTime.equals(that.endTime)
                && granularity == that.granularity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, endTime, granularity);
    }

    @Override
    public String toString() {
        return "AnalysisWindow{" + startTime + " .. " + endTime + ", " + granularity + '}';
    }
}
