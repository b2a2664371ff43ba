package com.failuresentinel.core.detection;

import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EngineError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link AnomalyDetector#detectAnomalies}.
 *
 * <p>
 * A failed result carries an {@link EngineError} and no patterns.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final boolean success;
    private final List<DetectedPattern> patterns;
    private final StatisticalSummary statisticalSummary;
    private final PerformanceMetrics performanceMetrics;
    private final EngineError error;

    private DetectionResult(boolean success, List<DetectedPattern> patterns,
            StatisticalSummary statisticalSummary, PerformanceMetrics performanceMetrics,
            EngineError error) {
        this.success = success;
        this.patterns = List.copyOf(patterns);
        this.statisticalSummary = Objects.requireNonNull(statisticalSummary, "statisticalSummary must not be null");
        this.performanceMetrics = Objects.requireNonNull(performanceMetrics, "performanceMetrics must not be null");
        this.error = error;
    }

    public static DetectionResult success(List<DetectedPattern> patterns, StatisticalSummary summary,
            PerformanceMetrics metrics) {
        return new DetectionResult(true, Objects.requireNonNull(patterns, "patterns must not be null"),
                summary, metrics, null);
    }

    public static DetectionResult failure(EngineError error) {
        return new DetectionResult(false, List.of(), StatisticalSummary.empty(), PerformanceMetrics.zero(),
                Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public List<DetectedPattern> getPatterns() {
        return patterns;
    }

    public StatisticalSummary getStatisticalSummary() {
        return statisticalSummary;
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return performanceMetrics;
    }

    public Optional<EngineError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return success
                ? "DetectionResult{success, patterns=" + patterns.size() + ", " + statisticalSummary + '}'
                : "DetectionResult{failed, error=" + error + '}';
    }
}
