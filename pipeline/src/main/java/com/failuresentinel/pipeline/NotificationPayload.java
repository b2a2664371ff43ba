package com.failuresentinel.pipeline;

import com.failuresentinel.core.classification.ClassificationResult;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.Recommendation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything a downstream channel needs to alert on one severe pattern.
 *
 * <p>
 * {@code classification} is absent when the classification stage failed;
 * {@code recommendations} is empty when the recommendation stage failed or
 * produced nothing for the pattern.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "pattern", "classification", "recommendations", "generatedAt" })
public final class NotificationPayload {

    private final DetectedPattern pattern;
    private final ClassificationResult classification;
    private final List<Recommendation> recommendations;
    private final Instant generatedAt;

    public NotificationPayload(DetectedPattern pattern, ClassificationResult classification,
            List<Recommendation> recommendations, Instant generatedAt) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.classification = classification;
        this.recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }

    public DetectedPattern getPattern() {
        return pattern;
    }

    public ClassificationResult getClassification() {
        return classification;
    }

    public List<Recommendation> getRecommendations() {
        return recommendations;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    @Override
    public String toString() {
        return "NotificationPayload{patternId='" + pattern.getPatternId() + '\''
                + ", severity=" + pattern.getSeverity()
                + ", recommendations=" + recommendations.size()
                + ", generatedAt=" + generatedAt + '}';
    }
}
