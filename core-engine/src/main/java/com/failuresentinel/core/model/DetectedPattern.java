package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A group of contiguous or closely spaced anomalous readings from one sensor.
 *
 * <p>
 * Owned by the detector and read-only downstream. The data points are kept in
 * timestamp order; {@code startTime}/{@code endTime} default to the first and
 * last data point when not given explicitly.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code patternId}, {@code equipmentType},
 * {@code severity} and {@code detectedAt} are required and the confidence
 * score must lie in {@code [0, 100]}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DetectedPattern {

    private final String patternId;
    private final String sensorId;
    private final EquipmentType equipmentType;
    private final Integer floorNumber;
    private final double confidenceScore;
    private final Severity severity;
    private final List<DataPoint> dataPoints;
    private final Instant detectedAt;
    private final Instant startTime;
    private final Instant endTime;
    private final String detectionAlgorithm;
    private final String description;

    private DetectedPattern(Builder builder) {
        this.patternId = Objects.requireNonNull(builder.patternId, "patternId must not be null");
        this.equipmentType = Objects.requireNonNull(builder.equipmentType, "equipmentType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        if (!(builder.confidenceScore >= 0 && builder.confidenceScore <= 100)) {
            throw new IllegalArgumentException(
                    "confidenceScore must be in [0, 100], got: " + builder.confidenceScore);
        }
        this.sensorId = builder.sensorId;
        this.floorNumber = builder.floorNumber;
        this.confidenceScore = builder.confidenceScore;
        this.dataPoints = builder.dataPoints == null
                ? List.of()
                : List.copyOf(builder.dataPoints);
        this.startTime = builder.startTime != null || dataPoints.isEmpty()
                ? builder.startTime
                : dataPoints.get(0).getTimestamp();
        this.endTime = builder.endTime != null || dataPoints.isEmpty()
                ? builder.endTime
                : dataPoints.get(dataPoints.size() - 1).getTimestamp();
        this.detectionAlgorithm = builder.detectionAlgorithm;
        this.description = builder.description;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String patternId;
        private String sensorId;
        private EquipmentType equipmentType;
        private Integer floorNumber;
        private double confidenceScore;
        private Severity severity;
        private List<DataPoint> dataPoints;
        private Instant detectedAt;
        private Instant startTime;
        private Instant endTime;
        private String detectionAlgorithm;
        private String description;

        public Builder patternId(String patternId) {
            this.patternId = patternId;
            return this;
        }

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder equipmentType(EquipmentType equipmentType) {
            this.equipmentType = equipmentType;
            return this;
        }

        public Builder floorNumber(Integer floorNumber) {
            this.floorNumber = floorNumber;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder dataPoints(List<DataPoint> dataPoints) {
            this.dataPoints = dataPoints;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder detectionAlgorithm(String detectionAlgorithm) {
            this.detectionAlgorithm = detectionAlgorithm;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @return a new {@link DetectedPattern}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if the confidence score is out of
         *                                  range
         */
        public DetectedPattern build() {
            return new DetectedPattern(this);
        }
    }

    // ---------------------------------------------------------------
    // Derived values
    // ---------------------------------------------------------------

    /**
     * @return the largest severity score among the data points, or 0 when the
     *         pattern carries none
     */
    public double peakSeverityScore() {
        double peak = 0;
        for (DataPoint point : dataPoints) {
            peak = Math.max(peak, point.getSeverityScore());
        }
        return peak;
    }

    /**
     * Check whether two patterns' time windows overlap, allowing the given
     * slack on either side.
     *
     * @param other     pattern to compare with
     * @param tolerance extra gap still treated as overlapping
     * @return {@code false} when either pattern has no time window
     */
    public boolean overlaps(DetectedPattern other, Duration tolerance) {
        if (startTime == null || endTime == null
                || other.startTime == null || other.endTime == null) {
            return false;
        }
        return !startTime.isAfter(other.endTime.plus(tolerance))
                && !other.startTime.isAfter(endTime.plus(tolerance));
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getPatternId() {
        return patternId;
    }

    public String getSensorId() {
        return sensorId;
    }

    public EquipmentType getEquipmentType() {
        return equipmentType;
    }

    public Integer getFloorNumber() {
        return floorNumber;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return unmodifiable list of anomalous readings in timestamp order
     */
    public List<DataPoint> getDataPoints() {
        return Collections.unmodifiableList(dataPoints);
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public String getDetectionAlgorithm() {
        return detectionAlgorithm;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectedPattern that))
            return false;
        return patternId.equals(that.patternId);
    }

    @Override
    public int hashCode() {
        return patternId.hashCode();
    }

    @Override
    public String toString() {
        return "DetectedPattern{" +
                "patternId='" + patternId + '\'' +
                ", equipmentType=" + equipmentType +
                ", floorNumber=" + floorNumber +
                ", severity=" + severity +
                ", confidenceScore=" + confidenceScore +
                ", points=" + dataPoints.size() +
                '}';
    }
}
