package com.failuresentinel.core.classification;

import com.failuresentinel.core.config.ClassifierConfig;
import com.failuresentinel.core.model.DataPoint;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assigns a severity tier, a risk score, a temporal shape and an urgency to
 * each detected pattern.
 *
 * <h3>Risk score</h3>
 * <p>
 * {@code 100 · (wc · confidence/100 + wm · min(1, peak/magSat) + wd · min(1, count/durSat))},
 * clamped to {@code [0, 100]}. Weights and saturation points come from
 * {@link ClassifierConfig}.
 * </p>
 *
 * <h3>Severity</h3>
 * <ul>
 * <li>{@code CRITICAL} requires both confidence {@code >= criticalConfidence}
 * and peak {@code > criticalMagnitude}</li>
 * <li>{@code WARNING} requires confidence {@code >= warningConfidence} or peak
 * {@code > warningMagnitude}</li>
 * <li>{@code INFO} otherwise</li>
 * </ul>
 *
 * <p>
 * The classifier never fails on pattern content: a pattern without data
 * points is scored with peak 0 and duration 0. Output is one result per input,
 * in input order.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(PatternClassifier.class);

    /** Gap ratio above which spacing counts as irregular. */
    static final double INTERMITTENT_GAP_RATIO = 1.5;

    private final ClassifierConfig config;

    public PatternClassifier() {
        this(new ClassifierConfig());
    }

    /**
     * @param config classifier settings; validated here
     * @throws IllegalStateException if the settings are invalid
     */
    public PatternClassifier(ClassifierConfig config) {
        this.config = Objects.requireNonNull(config, "ClassifierConfig must not be null");
        config.validate();
    }

    /**
     * @param patterns patterns to classify; neither the list nor its elements
     *                 may be {@code null}
     * @return one result per pattern, in input order
     */
    public List<ClassificationResult> classifyPatterns(List<DetectedPattern> patterns) {
        Objects.requireNonNull(patterns, "patterns must not be null");
        List<ClassificationResult> results = new ArrayList<>(patterns.size());
        for (DetectedPattern pattern : patterns) {
            results.add(classify(Objects.requireNonNull(pattern, "pattern must not be null")));
        }
        LOG.debug("Classified {} pattern(s)", results.size());
        return results;
    }

    /**
     * Classify a single pattern.
     */
    public ClassificationResult classify(DetectedPattern pattern) {
        List<DataPoint> points = pattern.getDataPoints();
        double confidence = pattern.getConfidenceScore();
        double peak = pattern.peakSeverityScore();
        int count = points.size();

        double risk = riskScore(confidence, peak, count);
        Severity severity = severity(confidence, peak);
        ClassifiedPatternType type = patternType(points);
        UrgencyLevel urgency = urgency(severity, risk, confidence);

        return new ClassificationResult(pattern.getPatternId(), severity, risk, type, urgency, peak, count);
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    double riskScore(double confidence, double peak, int count) {
        double score = 100.0 * (config.getConfidenceWeight() * confidence / 100.0
                + config.getMagnitudeWeight() * Math.min(1.0, peak / config.getMagnitudeSaturation())
                + config.getDurationWeight() * Math.min(1.0, (double) count / config.getDurationSaturation()));
        return Statistics.round1(Statistics.clamp(score, 0.0, 100.0));
    }

    Severity severity(double confidence, double peak) {
        if (confidence >= config.getCriticalConfidence() && peak > config.getCriticalMagnitude()) {
            return Severity.CRITICAL;
        }
        if (confidence >= config.getWarningConfidence() || peak > config.getWarningMagnitude()) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    ClassifiedPatternType patternType(List<DataPoint> points) {
        if (points.size() <= 2) {
            return ClassifiedPatternType.SUDDEN_SPIKE;
        }
        double[] scores = points.stream().mapToDouble(DataPoint::getSeverityScore).toArray();
        double mean = Statistics.mean(scores);
        if (mean > 0 && Statistics.slope(scores) / mean >= config.getDegradationRate()) {
            return ClassifiedPatternType.GRADUAL_DEGRADATION;
        }

        long minGap = Long.MAX_VALUE;
        long maxGap = 0;
        for (int i = 1; i < points.size(); i++) {
            long gap = Duration.between(points.get(i - 1).getTimestamp(), points.get(i).getTimestamp()).toMillis();
            if (gap > 0) {
                minGap = Math.min(minGap, gap);
                maxGap = Math.max(maxGap, gap);
            }
        }
        if (maxGap > 0 && maxGap > INTERMITTENT_GAP_RATIO * minGap) {
            return ClassifiedPatternType.INTERMITTENT_FAILURE;
        }
        return ClassifiedPatternType.SUSTAINED_FAILURE;
    }

    static UrgencyLevel urgency(Severity severity, double risk, double confidence) {
        boolean critical = severity == Severity.CRITICAL;
        if (critical && (risk >= 75 || confidence >= 95)) {
            return UrgencyLevel.IMMEDIATE;
        }
        if (risk >= 70 || critical) {
            return UrgencyLevel.URGENT;
        }
        if (risk >= 40 || severity == Severity.WARNING) {
            return UrgencyLevel.SCHEDULED;
        }
        return UrgencyLevel.MONITOR;
    }
}
