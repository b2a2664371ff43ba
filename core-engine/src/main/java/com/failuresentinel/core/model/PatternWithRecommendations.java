package com.failuresentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A detected pattern together with its ordered recommendations. The list is
 * empty, never {@code null}, when no action is viable.
 *
 * @since 1.0.0
 */
public final class PatternWithRecommendations {

    private final DetectedPattern pattern;
    private final List<Recommendation> recommendations;

    public PatternWithRecommendations(DetectedPattern pattern, List<Recommendation> recommendations) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.recommendations = List.copyOf(
                Objects.requireNonNull(recommendations, "recommendations must not be null"));
    }

    public DetectedPattern getPattern() {
        return pattern;
    }

    public List<Recommendation> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        return "PatternWithRecommendations{pattern=" + pattern.getPatternId()
                + ", recommendations=" + recommendations.size() + '}';
    }
}
