package com.failuresentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable cutoffs and weights of the pattern classifier.
 *
 * <p>
 * Severity tiers and risk weights are deployment configuration rather than
 * constants. Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassifierConfig {

    // --- Severity tiers ---
    private double criticalConfidence = 90.0;
    private double criticalMagnitude = 3.0;
    private double warningConfidence = 70.0;
    private double warningMagnitude = 2.0;

    // --- Risk score ---
    private double confidenceWeight = 0.5;
    private double magnitudeWeight = 0.3;
    private double durationWeight = 0.2;
    /** Peak severity score at which the magnitude term saturates. */
    private double magnitudeSaturation = 6.0;
    /** Point count at which the duration term saturates. */
    private int durationSaturation = 12;

    /** Relative severity slope per point above which a pattern is degrading. */
    private double degradationRate = 0.1;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkPercent(errors, "criticalConfidence", criticalConfidence);
        checkPercent(errors, "warningConfidence", warningConfidence);
        if (warningConfidence > criticalConfidence) {
            errors.add("'warningConfidence' must not exceed 'criticalConfidence'");
        }
        if (!(criticalMagnitude > 0)) {
            errors.add("'criticalMagnitude' must be > 0");
        }
        if (!(warningMagnitude > 0)) {
            errors.add("'warningMagnitude' must be > 0");
        }
        if (warningMagnitude > criticalMagnitude) {
            errors.add("'warningMagnitude' must not exceed 'criticalMagnitude'");
        }
        if (confidenceWeight < 0 || magnitudeWeight < 0 || durationWeight < 0) {
            errors.add("risk weights must be >= 0");
        }
        if (Math.abs(confidenceWeight + magnitudeWeight + durationWeight - 1.0) > 1e-6) {
            errors.add("risk weights must sum to 1.0, got: "
                    + (confidenceWeight + magnitudeWeight + durationWeight));
        }
        if (!(magnitudeSaturation > 0)) {
            errors.add("'magnitudeSaturation' must be > 0");
        }
        if (durationSaturation < 1) {
            errors.add("'durationSaturation' must be >= 1");
        }
        if (!(degradationRate > 0)) {
            errors.add("'degradationRate' must be > 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ClassifierConfig: " + String.join("; ", errors));
        }
    }

    private static void checkPercent(List<String> errors, String name, double value) {
        if (!(value >= 0 && value <= 100)) {
            errors.add("'" + name + "' must be in [0, 100], got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getCriticalConfidence() {
        return criticalConfidence;
    }

    public void setCriticalConfidence(double criticalConfidence) {
        this.criticalConfidence = criticalConfidence;
    }

    public double getCriticalMagnitude() {
        return criticalMagnitude;
    }

    public void setCriticalMagnitude(double criticalMagnitude) {
        this.criticalMagnitude = criticalMagnitude;
    }

    public double getWarningConfidence() {
        return warningConfidence;
    }

    public void setWarningConfidence(double warningConfidence) {
        this.warningConfidence = warningConfidence;
    }

    public double getWarningMagnitude() {
        return warningMagnitude;
    }

    public void setWarningMagnitude(double warningMagnitude) {
        this.warningMagnitude = warningMagnitude;
    }

    public double getConfidenceWeight() {
        return confidenceWeight;
    }

    public void setConfidenceWeight(double confidenceWeight) {
        this.confidenceWeight = confidenceWeight;
    }

    public double getMagnitudeWeight() {
        return magnitudeWeight;
    }

    public void setMagnitudeWeight(double magnitudeWeight) {
        this.magnitudeWeight = magnitudeWeight;
    }

    public double getDurationWeight() {
        return durationWeight;
    }

    public void setDurationWeight(double durationWeight) {
        this.durationWeight = durationWeight;
    }

    public double getMagnitudeSaturation() {
        return magnitudeSaturation;
    }

    public void setMagnitudeSaturation(double magnitudeSaturation) {
        this.magnitudeSaturation = magnitudeSaturation;
    }

    public int getDurationSaturation() {
        return durationSaturation;
    }

    public void setDurationSaturation(int durationSaturation) {
        this.durationSaturation = durationSaturation;
    }

    public double getDegradationRate() {
        return degradationRate;
    }

    public void setDegradationRate(double degradationRate) {
        this.degradationRate = degradationRate;
    }

    @Override
    public String toString() {
        return "ClassifierConfig{" +
                "critical=" + criticalConfidence + "/" + criticalMagnitude +
                ", warning=" + warningConfidence + "/" + warningMagnitude +
                ", weights=" + confidenceWeight + "/" + magnitudeWeight + "/" + durationWeight +
                '}';
    }
}
