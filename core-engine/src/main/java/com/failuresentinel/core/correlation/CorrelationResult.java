package com.failuresentinel.core.correlation;

import com.failuresentinel.core.model.EngineError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link PatternCorrelationAnalyzer#analyzeCorrelations}.
 * Finding no correlations is a successful, empty result.
 *
 * @since 1.0.0
 */
public final class CorrelationResult {

    private final boolean success;
    private final CorrelationMatrix correlationMatrix;
    private final List<TemporalCorrelation> temporalCorrelations;
    private final List<FloorCorrelation> floorCorrelations;
    private final long processingTimeMs;
    private final EngineError error;

    private CorrelationResult(boolean success, CorrelationMatrix correlationMatrix,
            List<TemporalCorrelation> temporalCorrelations, List<FloorCorrelation> floorCorrelations,
            long processingTimeMs, EngineError error) {
        this.success = success;
        this.correlationMatrix = correlationMatrix;
        this.temporalCorrelations = List.copyOf(temporalCorrelations);
        this.floorCorrelations = List.copyOf(floorCorrelations);
        this.processingTimeMs = processingTimeMs;
        this.error = error;
    }

    public static CorrelationResult success(CorrelationMatrix matrix, List<TemporalCorrelation> temporal,
            List<FloorCorrelation> floors, long processingTimeMs) {
        return new CorrelationResult(true, Objects.requireNonNull(matrix, "matrix must not be null"),
                temporal, floors, processingTimeMs, null);
    }

    public static CorrelationResult failure(EngineError error, long processingTimeMs) {
        return new CorrelationResult(false, CorrelationMatrix.empty(), List.of(), List.of(),
                processingTimeMs, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return success;
    }

    public CorrelationMatrix getCorrelationMatrix() {
        return correlationMatrix;
    }

    /**
     * @return pairs whose best-lag correlation reached the reporting minimum,
     *         strongest first
     */
    public List<TemporalCorrelation> getTemporalCorrelations() {
        return temporalCorrelations;
    }

    public List<FloorCorrelation> getFloorCorrelations() {
        return floorCorrelations;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public Optional<EngineError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return success
                ? "CorrelationResult{success, patterns=" + correlationMatrix.size()
                        + ", temporal=" + temporalCorrelations.size() + '}'
                : "CorrelationResult{failed, error=" + error + '}';
    }
}
