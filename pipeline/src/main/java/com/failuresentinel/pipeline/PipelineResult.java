package com.failuresentinel.pipeline;

import com.failuresentinel.core.classification.ClassificationResult;
import com.failuresentinel.core.correlation.CorrelationResult;
import com.failuresentinel.core.detection.DetectionResult;
import com.failuresentinel.core.model.PatternWithRecommendations;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link FailurePatternPipeline} run.
 *
 * <p>
 * Stage outputs that could not be produced are empty (or absent for the
 * correlation result) and the reason is listed in {@link #getStageFailures()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final DetectionResult detection;
    private final List<ClassificationResult> classifications;
    private final CorrelationResult correlation;
    private final List<PatternWithRecommendations> recommendations;
    private final List<NotificationPayload> notifications;
    private final List<StageFailure> stageFailures;
    private final long processingTimeMs;

    PipelineResult(DetectionResult detection, List<ClassificationResult> classifications,
            CorrelationResult correlation, List<PatternWithRecommendations> recommendations,
            List<NotificationPayload> notifications, List<StageFailure> stageFailures,
            long processingTimeMs) {
        this.detection = Objects.requireNonNull(detection, "detection must not be null");
        this.classifications = List.copyOf(classifications);
        this.correlation = correlation;
        this.recommendations = List.copyOf(recommendations);
        this.notifications = List.copyOf(notifications);
        this.stageFailures = List.copyOf(stageFailures);
        this.processingTimeMs = processingTimeMs;
    }

    /**
     * @return {@code true} if every stage that ran completed
     */
    public boolean isSuccess() {
        return stageFailures.isEmpty();
    }

    public boolean hasFailed(PipelineStage stage) {
        return stageFailures.stream().anyMatch(f -> f.getStage() == stage);
    }

    public DetectionResult getDetection() {
        return detection;
    }

    public List<ClassificationResult> getClassifications() {
        return classifications;
    }

    /**
     * @return the correlation outcome; empty when correlation is disabled,
     *         was skipped, or threw
     */
    public Optional<CorrelationResult> getCorrelation() {
        return Optional.ofNullable(correlation);
    }

    public List<PatternWithRecommendations> getRecommendations() {
        return recommendations;
    }

    public List<NotificationPayload> getNotifications() {
        return notifications;
    }

    public List<StageFailure> getStageFailures() {
        return stageFailures;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    @Override
    public String toString() {
        return "PipelineResult{patterns=" + detection.getPatterns().size()
                + ", classifications=" + classifications.size()
                + ", recommendations=" + recommendations.size()
                + ", notifications=" + notifications.size()
                + ", failures=" + stageFailures
                + ", processingTimeMs=" + processingTimeMs + '}';
    }
}
