package com.failuresentinel.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the pattern correlation analyzer.
 *
 * @since 1.0.0
 */
public class CorrelationConfig {

    /** Slack allowed between two windows that still count as overlapping. */
    private int overlapToleranceMinutes = 30;
    /** Largest lag, in grid steps, tried on either side. */
    private int maxLagSteps = 6;
    /** Smallest best-lag correlation reported as temporal. */
    private double minCorrelation = 0.3;
    /** Upper bound on the slots of any pairwise grid. */
    private int maxGridSlots = 10_000;
    /** Grid step used when no positive spacing exists between timestamps. */
    private int defaultStepSeconds = 60;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (overlapToleranceMinutes < 0) {
            errors.add("'overlapToleranceMinutes' must be >= 0");
        }
        if (maxLagSteps < 0) {
            errors.add("'maxLagSteps' must be >= 0");
        }
        if (!(minCorrelation >= 0 && minCorrelation <= 1)) {
            errors.add("'minCorrelation' must be in [0, 1], got: " + minCorrelation);
        }
        if (maxGridSlots < 2 * maxLagSteps + 2) {
            errors.add("'maxGridSlots' must be at least 2 * maxLagSteps + 2");
        }
        if (defaultStepSeconds < 1) {
            errors.add("'defaultStepSeconds' must be >= 1");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid CorrelationConfig: " + String.join("; ", errors));
        }
    }

    public Duration overlapTolerance() {
        return Duration.ofMinutes(overlapToleranceMinutes);
    }

    public Duration defaultStep() {
        return Duration.ofSeconds(defaultStepSeconds);
    }

    public int getOverlapToleranceMinutes() {
        return overlapToleranceMinutes;
    }

    public void setOverlapToleranceMinutes(int overlapToleranceMinutes) {
        this.overlapToleranceMinutes = overlapToleranceMinutes;
    }

    public int getMaxLagSteps() {
        return maxLagSteps;
    }

    public void setMaxLagSteps(int maxLagSteps) {
        this.maxLagSteps = maxLagSteps;
    }

    public double getMinCorrelation() {
        return minCorrelation;
    }

    public void setMinCorrelation(double minCorrelation) {
        this.minCorrelation = minCorrelation;
    }

    public int getMaxGridSlots() {
        return maxGridSlots;
    }

    public void setMaxGridSlots(int maxGridSlots) {
        this.maxGridSlots = maxGridSlots;
    }

    public int getDefaultStepSeconds() {
        return defaultStepSeconds;
    }

    public void setDefaultStepSeconds(int defaultStepSeconds) {
        this.defaultStepSeconds = defaultStepSeconds;
    }

    @Override
    public String toString() {
        return "CorrelationConfig{" +
                "overlapToleranceMinutes=" + overlapToleranceMinutes +
                ", maxLagSteps=" + maxLagSteps +
                ", minCorrelation=" + minCorrelation +
                ", maxGridSlots=" + maxGridSlots +
                ", defaultStepSeconds=" + defaultStepSeconds +
                '}';
    }
}
