package com.failuresentinel.core.classification;

import com.failuresentinel.core.config.ClassifierConfig;
import com.failuresentinel.core.model.DataPoint;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PatternClassifier}.
 */
class PatternClassifierTest {

    private static final Instant BASE = Instant.parse("2024-05-01T08:00:00Z");

    private PatternClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new PatternClassifier();
    }

    @Test
    @DisplayName("Risk score should weight confidence, magnitude and duration")
    void shouldComputeRiskScore() {
        assertThat(classifier.riskScore(100, 6.0, 12)).isEqualTo(100.0);
        assertThat(classifier.riskScore(80, 3.0, 3)).isEqualTo(60.0);
        assertThat(classifier.riskScore(0, 0.0, 0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Severity should need both confidence and magnitude for critical")
    void shouldClassifySeverity() {
        assertThat(classifier.severity(95, 3.5)).isEqualTo(Severity.CRITICAL);
        assertThat(classifier.severity(95, 3.0)).isEqualTo(Severity.WARNING);
        assertThat(classifier.severity(72, 1.0)).isEqualTo(Severity.WARNING);
        assertThat(classifier.severity(50, 2.5)).isEqualTo(Severity.WARNING);
        assertThat(classifier.severity(50, 1.5)).isEqualTo(Severity.INFO);
    }

    @Test
    @DisplayName("Urgency should escalate with severity and risk")
    void shouldDeriveUrgency() {
        assertThat(PatternClassifier.urgency(Severity.CRITICAL, 80, 92)).isEqualTo(UrgencyLevel.IMMEDIATE);
        assertThat(PatternClassifier.urgency(Severity.CRITICAL, 60, 96)).isEqualTo(UrgencyLevel.IMMEDIATE);
        assertThat(PatternClassifier.urgency(Severity.CRITICAL, 60, 92)).isEqualTo(UrgencyLevel.URGENT);
        assertThat(PatternClassifier.urgency(Severity.INFO, 72, 60)).isEqualTo(UrgencyLevel.URGENT);
        assertThat(PatternClassifier.urgency(Severity.WARNING, 30, 60)).isEqualTo(UrgencyLevel.SCHEDULED);
        assertThat(PatternClassifier.urgency(Severity.INFO, 20, 50)).isEqualTo(UrgencyLevel.MONITOR);
        assertThat(UrgencyLevel.IMMEDIATE.getResponseTime()).isEqualTo(Duration.ofHours(2));
    }

    @Test
    @DisplayName("One or two readings should be a sudden spike")
    void shouldClassifySuddenSpike() {
        DetectedPattern pattern = pattern("p1", 95, hourly(4.0, 5.0));

        assertThat(classifier.classify(pattern).getPatternType()).isEqualTo(ClassifiedPatternType.SUDDEN_SPIKE);
    }

    @Test
    @DisplayName("Steadily rising scores should be gradual degradation")
    void shouldClassifyGradualDegradation() {
        DetectedPattern pattern = pattern("p1", 95, hourly(3.0, 4.0, 5.0, 6.0));

        assertThat(classifier.classify(pattern).getPatternType())
                .isEqualTo(ClassifiedPatternType.GRADUAL_DEGRADATION);
    }

    @Test
    @DisplayName("Irregular gaps between readings should be an intermittent failure")
    void shouldClassifyIntermittentFailure() {
        List<DataPoint> points = List.of(
                point(0, 4.0), point(60, 4.0), point(240, 4.0), point(300, 4.0));
        DetectedPattern pattern = pattern("p1", 95, points);

        assertThat(classifier.classify(pattern).getPatternType())
                .isEqualTo(ClassifiedPatternType.INTERMITTENT_FAILURE);
    }

    @Test
    @DisplayName("Evenly spaced flat scores should be a sustained failure")
    void shouldClassifySustainedFailure() {
        DetectedPattern pattern = pattern("p1", 95, hourly(4.0, 4.0, 4.0));

        assertThat(classifier.classify(pattern).getPatternType())
                .isEqualTo(ClassifiedPatternType.SUSTAINED_FAILURE);
    }

    @Test
    @DisplayName("classify should fill every field of the result")
    void shouldBuildFullResult() {
        ClassificationResult result = classifier.classify(pattern("p-critical", 98, hourly(7.0, 8.0)));

        assertThat(result.getPatternId()).isEqualTo("p-critical");
        assertThat(result.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.getPeakSeverityScore()).isEqualTo(8.0);
        assertThat(result.getAnomalousPoints()).isEqualTo(2);
        assertThat(result.getRiskScore()).isBetween(0.0, 100.0);
        assertThat(result.getUrgency()).isEqualTo(UrgencyLevel.IMMEDIATE);
    }

    @Test
    @DisplayName("classifyPatterns should keep input order")
    void shouldKeepInputOrder() {
        List<ClassificationResult> results = classifier.classifyPatterns(List.of(
                pattern("b", 60, hourly(2.6)),
                pattern("a", 99, hourly(9.0))));

        assertThat(results).extracting(ClassificationResult::getPatternId).containsExactly("b", "a");
        assertThat(results).extracting(ClassificationResult::getSeverity)
                .containsExactly(Severity.WARNING, Severity.CRITICAL);
    }

    @Test
    @DisplayName("classifyPatterns should reject null elements")
    void shouldRejectNullElement() {
        List<DetectedPattern> patterns = new ArrayList<>();
        patterns.add(null);

        assertThatThrownBy(() -> classifier.classifyPatterns(patterns))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should reject weights that do not sum to one")
    void shouldRejectInvalidConfig() {
        ClassifierConfig config = new ClassifierConfig();
        config.setConfidenceWeight(0.9);

        assertThatThrownBy(() -> new PatternClassifier(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("risk weights must sum to 1.0");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectedPattern pattern(String id, double confidence, List<DataPoint> points) {
        return DetectedPattern.builder()
                .patternId(id)
                .sensorId("sensor-" + id)
                .equipmentType(EquipmentType.HVAC)
                .confidenceScore(confidence)
                .severity(Severity.WARNING)
                .dataPoints(points)
                .detectedAt(BASE)
                .build();
    }

    private List<DataPoint> hourly(double... scores) {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            points.add(point(60 * i, scores[i]));
        }
        return points;
    }

    private DataPoint point(int minutes, double score) {
        return new DataPoint(BASE.plus(Duration.ofMinutes(minutes)), 100 + score, 100, score);
    }
}
