package com.failuresentinel.core.config;

import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.ErrorType;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of the anomaly detector.
 *
 * <p>
 * Instances are validated eagerly: {@link Builder#build()} runs
 * {@link #validate(Builder)} and throws {@link InvalidConfigurationException}
 * before any data is processed, so a detector never sees an out-of-range
 * value.
 * </p>
 *
 * <h3>Defaults</h3>
 * <table>
 * <caption>Field defaults</caption>
 * <tr><td>algorithmType</td><td>statistical_zscore</td></tr>
 * <tr><td>sensitivity</td><td>7 (1..10)</td></tr>
 * <tr><td>thresholdMultiplier</td><td>2.5 (&gt; 0)</td></tr>
 * <tr><td>minimumDataPoints</td><td>20 (&ge; 1)</td></tr>
 * <tr><td>lookbackPeriod</td><td>24 hours</td></tr>
 * <tr><td>seasonalAdjustment</td><td>true</td></tr>
 * <tr><td>outlierHandling</td><td>cap</td></tr>
 * <tr><td>confidenceMethod</td><td>statistical</td></tr>
 * <tr><td>patternMergeGap</td><td>2 points</td></tr>
 * <tr><td>timeZone</td><td>UTC</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class DetectorConfig {

    public static final int MIN_SENSITIVITY = 1;
    public static final int MAX_SENSITIVITY = 10;

    private final AlgorithmType algorithmType;
    private final int sensitivity;
    private final double thresholdMultiplier;
    private final int minimumDataPoints;
    private final Duration lookbackPeriod;
    private final boolean seasonalAdjustment;
    private final OutlierHandling outlierHandling;
    private final ConfidenceMethod confidenceMethod;
    private final int patternMergeGap;
    private final ZoneId timeZone;

    private DetectorConfig(Builder builder) {
        this.algorithmType = builder.algorithmType;
        this.sensitivity = builder.sensitivity;
        this.thresholdMultiplier = builder.thresholdMultiplier;
        this.minimumDataPoints = builder.minimumDataPoints;
        this.lookbackPeriod = builder.lookbackPeriod;
        this.seasonalAdjustment = builder.seasonalAdjustment;
        this.outlierHandling = builder.outlierHandling;
        this.confidenceMethod = builder.confidenceMethod;
        this.patternMergeGap = builder.patternMergeGap;
        this.timeZone = builder.timeZone;
    }

    /**
     * @return a configuration with every field at its default
     */
    public static DetectorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validate the builder's current values.
     *
     * @param builder values to check; must not be {@code null}
     * @return an {@link ErrorType#INVALID_CONFIGURATION} error listing every
     *         problem, or empty when the values are valid
     */
    public static Optional<EngineError> validate(Builder builder) {
        Objects.requireNonNull(builder, "builder must not be null");
        List<String> errors = new ArrayList<>();

        if (builder.algorithmType == null) {
            errors.add("'algorithmType' is required");
        }
        if (builder.sensitivity < MIN_SENSITIVITY || builder.sensitivity > MAX_SENSITIVITY) {
            errors.add("'sensitivity' must be between " + MIN_SENSITIVITY + " and "
                    + MAX_SENSITIVITY + ", got: " + builder.sensitivity);
        }
        if (!(builder.thresholdMultiplier > 0) || Double.isInfinite(builder.thresholdMultiplier)) {
            errors.add("'thresholdMultiplier' must be a finite value > 0, got: "
                    + builder.thresholdMultiplier);
        }
        if (builder.minimumDataPoints < 1) {
            errors.add("'minimumDataPoints' must be >= 1, got: " + builder.minimumDataPoints);
        }
        if (builder.lookbackPeriod == null
                || builder.lookbackPeriod.isZero() || builder.lookbackPeriod.isNegative()) {
            errors.add("'lookbackPeriod' must be a positive duration, got: " + builder.lookbackPeriod);
        }
        if (builder.outlierHandling == null) {
            errors.add("'outlierHandling' is required");
        }
        if (builder.confidenceMethod == null) {
            errors.add("'confidenceMethod' is required");
        }
        if (builder.patternMergeGap < 1) {
            errors.add("'patternMergeGap' must be >= 1, got: " + builder.patternMergeGap);
        }
        if (builder.timeZone == null) {
            errors.add("'timeZone' is required");
        }

        if (errors.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(EngineError.of(ErrorType.INVALID_CONFIGURATION,
                "Invalid DetectorConfig: " + String.join("; ", errors)));
    }

    /**
     * Minimum confidence a pattern needs to be reported at this sensitivity.
     * Sensitivity 10 reports from 40, sensitivity 1 only from 85.
     *
     * @return reporting floor on the 0-100 confidence scale
     */
    public double reportingConfidenceFloor() {
        return 40.0 + 5.0 * (MAX_SENSITIVITY - sensitivity);
    }

    public Builder toBuilder() {
        return builder()
                .algorithmType(algorithmType)
                .sensitivity(sensitivity)
                .thresholdMultiplier(thresholdMultiplier)
                .minimumDataPoints(minimumDataPoints)
                .lookbackPeriod(lookbackPeriod)
                .seasonalAdjustment(seasonalAdjustment)
                .outlierHandling(outlierHandling)
                .confidenceMethod(confidenceMethod)
                .patternMergeGap(patternMergeGap)
                .timeZone(timeZone);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private AlgorithmType algorithmType = AlgorithmType.STATISTICAL_ZSCORE;
        private int sensitivity = 7;
        private double thresholdMultiplier = 2.5;
        private int minimumDataPoints = 20;
        private Duration lookbackPeriod = Duration.ofHours(24);
        private boolean seasonalAdjustment = true;
        private OutlierHandling outlierHandling = OutlierHandling.CAP;
        private ConfidenceMethod confidenceMethod = ConfidenceMethod.STATISTICAL;
        private int patternMergeGap = 2;
        private ZoneId timeZone = ZoneOffset.UTC;

        public Builder algorithmType(AlgorithmType algorithmType) {
            this.algorithmType = algorithmType;
            return this;
        }

        public Builder sensitivity(int sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public Builder thresholdMultiplier(double thresholdMultiplier) {
            this.thresholdMultiplier = thresholdMultiplier;
            return this;
        }

        public Builder minimumDataPoints(int minimumDataPoints) {
            this.minimumDataPoints = minimumDataPoints;
            return this;
        }

        public Builder lookbackPeriod(Duration lookbackPeriod) {
            this.lookbackPeriod = lookbackPeriod;
            return this;
        }

        public Builder seasonalAdjustment(boolean seasonalAdjustment) {
            this.seasonalAdjustment = seasonalAdjustment;
            return this;
        }

        public Builder outlierHandling(OutlierHandling outlierHandling) {
            this.outlierHandling = outlierHandling;
            return this;
        }

        public Builder confidenceMethod(ConfidenceMethod confidenceMethod) {
            this.confidenceMethod = confidenceMethod;
            return this;
        }

        public Builder patternMergeGap(int patternMergeGap) {
            this.patternMergeGap = patternMergeGap;
            return this;
        }

        public Builder timeZone(ZoneId timeZone) {
            this.timeZone = timeZone;
            return this;
        }

        /**
         * @return validated configuration
         * @throws InvalidConfigurationException if any value is out of range
         */
        public DetectorConfig build() {
            Optional<EngineError> error = validate(this);
            if (error.isPresent()) {
                throw new InvalidConfigurationException(error.get());
            }
            return new DetectorConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public AlgorithmType getAlgorithmType() {
        return algorithmType;
    }

    public int getSensitivity() {
        return sensitivity;
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public int getMinimumDataPoints() {
        return minimumDataPoints;
    }

    public Duration getLookbackPeriod() {
        return lookbackPeriod;
    }

    public boolean isSeasonalAdjustment() {
        return seasonalAdjustment;
    }

    public OutlierHandling getOutlierHandling() {
        return outlierHandling;
    }

    public ConfidenceMethod getConfidenceMethod() {
        return confidenceMethod;
    }

    public int getPatternMergeGap() {
        return patternMergeGap;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "algorithmType=" + algorithmType +
                ", sensitivity=" + sensitivity +
                ", thresholdMultiplier=" + thresholdMultiplier +
                ", minimumDataPoints=" + minimumDataPoints +
                ", lookbackPeriod=" + lookbackPeriod +
                ", seasonalAdjustment=" + seasonalAdjustment +
                ", outlierHandling=" + outlierHandling +
                ", confidenceMethod=" + confidenceMethod +
                ", patternMergeGap=" + patternMergeGap +
                ", timeZone=" + timeZone +
                '}';
    }
}
