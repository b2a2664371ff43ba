package com.failuresentinel.core.config;

import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.ErrorType;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

/**
 * YAML-bindable mirror of {@link DetectorConfig}.
 *
 * <p>
 * Enum-valued settings are plain lowercase strings so the YAML reads
 * naturally:
 * </p>
 *
 * <pre>
 * detector:
 *   algorithmType: seasonal_decomposition
 *   sensitivity: 8
 *   thresholdMultiplier: 2.5
 *   lookbackHours: 48
 *   outlierHandling: remove
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorProperties {

    private String algorithmType = "statistical_zscore";
    private int sensitivity = 7;
    private double thresholdMultiplier = 2.5;
    private int minimumDataPoints = 20;
    private int lookbackHours = 24;
    private boolean seasonalAdjustment = true;
    private String outlierHandling = "cap";
    private String confidenceMethod = "statistical";
    private int patternMergeGap = 2;
    private String timeZone = "UTC";

    /**
     * Convert to a validated {@link DetectorConfig}.
     *
     * @return immutable detector configuration
     * @throws InvalidConfigurationException if a value is unknown or out of
     *                                       range
     */
    public DetectorConfig toDetectorConfig() {
        try {
            return DetectorConfig.builder()
                    .algorithmType(AlgorithmType.fromValue(algorithmType))
                    .sensitivity(sensitivity)
                    .thresholdMultiplier(thresholdMultiplier)
                    .minimumDataPoints(minimumDataPoints)
                    .lookbackPeriod(Duration.ofHours(lookbackHours))
                    .seasonalAdjustment(seasonalAdjustment)
                    .outlierHandling(OutlierHandling.fromValue(outlierHandling))
                    .confidenceMethod(ConfidenceMethod.fromValue(confidenceMethod))
                    .patternMergeGap(patternMergeGap)
                    .timeZone(ZoneId.of(timeZone))
                    .build();
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new InvalidConfigurationException(EngineError.of(ErrorType.INVALID_CONFIGURATION,
                    "Invalid DetectorConfig: " + e.getMessage()), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getAlgorithmType() {
        return algorithmType;
    }

    public void setAlgorithmType(String algorithmType) {
        this.algorithmType = algorithmType != null ? algorithmType.toLowerCase(Locale.ROOT) : null;
    }

    public int getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(int sensitivity) {
        this.sensitivity = sensitivity;
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public void setThresholdMultiplier(double thresholdMultiplier) {
        this.thresholdMultiplier = thresholdMultiplier;
    }

    public int getMinimumDataPoints() {
        return minimumDataPoints;
    }

    public void setMinimumDataPoints(int minimumDataPoints) {
        this.minimumDataPoints = minimumDataPoints;
    }

    public int getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(int lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public boolean isSeasonalAdjustment() {
        return seasonalAdjustment;
    }

    public void setSeasonalAdjustment(boolean seasonalAdjustment) {
        this.seasonalAdjustment = seasonalAdjustment;
    }

    public String getOutlierHandling() {
        return outlierHandling;
    }

    public void setOutlierHandling(String outlierHandling) {
        this.outlierHandling = outlierHandling != null ? outlierHandling.toLowerCase(Locale.ROOT) : null;
    }

    public String getConfidenceMethod() {
        return confidenceMethod;
    }

    public void setConfidenceMethod(String confidenceMethod) {
        this.confidenceMethod = confidenceMethod != null ? confidenceMethod.toLowerCase(Locale.ROOT) : null;
    }

    public int getPatternMergeGap() {
        return patternMergeGap;
    }

    public void setPatternMergeGap(int patternMergeGap) {
        this.patternMergeGap = patternMergeGap;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    @Override
    public String toString() {
        return "DetectorProperties{" +
                "algorithmType='" + algorithmType + '\'' +
                ", sensitivity=" + sensitivity +
                ", thresholdMultiplier=" + thresholdMultiplier +
                ", minimumDataPoints=" + minimumDataPoints +
                ", lookbackHours=" + lookbackHours +
                ", seasonalAdjustment=" + seasonalAdjustment +
                ", outlierHandling='" + outlierHandling + '\'' +
                ", confidenceMethod='" + confidenceMethod + '\'' +
                ", patternMergeGap=" + patternMergeGap +
                ", timeZone='" + timeZone + '\'' +
                '}';
    }
}
