package com.failuresentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section and key is optional):
 * </p>
 *
 * <pre>
 * detector:
 *   algorithmType: statistical_zscore
 *   sensitivity: 7
 * classifier:
 *   criticalConfidence: 90
 *   criticalMagnitude: 3.0
 * correlation:
 *   maxLagSteps: 6
 * recommendation:
 *   budgetPolicy: flag
 * </pre>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private DetectorProperties detector = new DetectorProperties();
    private ClassifierConfig classifier = new ClassifierConfig();
    private CorrelationConfig correlation = new CorrelationConfig();
    private RecommendationConfig recommendation = new RecommendationConfig();

    /**
     * Validate every section.
     *
     * <p>
     * Collects the problems of all sections and throws a single exception if
     * any section is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            detector.toDetectorConfig();
        } catch (InvalidConfigurationException e) {
            errors.add(e.getMessage());
        }
        for (Runnable section : List.<Runnable>of(
                classifier::validate, correlation::validate, recommendation::validate)) {
            try {
                section.run();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return the validated detector configuration
     * @throws InvalidConfigurationException if the detector section is invalid
     */
    public DetectorConfig detectorConfig() {
        return detector.toDetectorConfig();
    }

    public DetectorProperties getDetector() {
        return detector;
    }

    public void setDetector(DetectorProperties detector) {
        this.detector = detector != null ? detector : new DetectorProperties();
    }

    public ClassifierConfig getClassifier() {
        return classifier;
    }

    public void setClassifier(ClassifierConfig classifier) {
        this.classifier = classifier != null ? classifier : new ClassifierConfig();
    }

    public CorrelationConfig getCorrelation() {
        return correlation;
    }

    public void setCorrelation(CorrelationConfig correlation) {
        this.correlation = correlation != null ? correlation : new CorrelationConfig();
    }

    public RecommendationConfig getRecommendation() {
        return recommendation;
    }

    public void setRecommendation(RecommendationConfig recommendation) {
        this.recommendation = recommendation != null ? recommendation : new RecommendationConfig();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "detector=" + detector +
                ", classifier=" + classifier +
                ", correlation=" + correlation +
                ", recommendation=" + recommendation +
                '}';
    }
}
