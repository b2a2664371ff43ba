package com.failuresentinel.core.classification;

import com.failuresentinel.core.model.Severity;

import java.util.Objects;

/**
 * Classification of one detected pattern, linked back by {@code patternId}.
 *
 * @since 1.0.0
 */
public final class ClassificationResult {

    private final String patternId;
    private final Severity severity;
    private final double riskScore;
    private final ClassifiedPatternType patternType;
    private final UrgencyLevel urgency;
    private final double peakSeverityScore;
    private final int anomalousPoints;

    public ClassificationResult(String patternId, Severity severity, double riskScore,
            ClassifiedPatternType patternType, UrgencyLevel urgency,
            double peakSeverityScore, int anomalousPoints) {
        this.patternId = Objects.requireNonNull(patternId, "patternId must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.patternType = Objects.requireNonNull(patternType, "patternType must not be null");
        this.urgency = Objects.requireNonNull(urgency, "urgency must not be null");
        if (!(riskScore >= 0 && riskScore <= 100)) {
            throw new IllegalArgumentException("riskScore must be in [0, 100], got: " + riskScore);
        }
        this.riskScore = riskScore;
        this.peakSeverityScore = peakSeverityScore;
        this.anomalousPoints = anomalousPoints;
    }

    public String getPatternId() {
        return patternId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public ClassifiedPatternType getPatternType() {
        return patternType;
    }

    public UrgencyLevel getUrgency() {
        return urgency;
    }

    public double getPeakSeverityScore() {
        return peakSeverityScore;
    }

    public int getAnomalousPoints() {
        return anomalousPoints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassificationResult that))
            return false;
        return Double.compare(riskScore, that.riskScore) == 0
                && patternId.equals(that.patternId)
                && severity == that.severity
                && patternType == that.patternType
                && urgency == that.urgency;
    }

    @Override
    public int hashCode() {
        return Objects.hash(patternId, severity, riskScore, patternType, urgency);
    }

    @Override
    public String toString() {
        return "ClassificationResult{" +
                "patternId='" + patternId + '\'' +
                ", severity=" + severity +
                ", riskScore=" + riskScore +
                ", type=" + patternType +
                ", urgency=" + urgency +
                '}';
    }
}
