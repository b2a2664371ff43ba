package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.DetectorConfig;
import com.failuresentinel.core.model.AnalysisWindow;
import com.failuresentinel.core.model.DataPoint;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.ErrorType;
import com.failuresentinel.core.model.Granularity;
import com.failuresentinel.core.model.TimeSeriesPoint;
import com.failuresentinel.core.util.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Shared detection pipeline of the baseline-driven detectors.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Keep points inside {@code [max(start, end - lookback), end]}; count the
 * rest as outside the window and skip non-finite values.</li>
 * <li>Group by sensor, sort by time, skip sensors with fewer than
 * {@code minimumDataPoints} readings.</li>
 * <li>Compute the residual series ({@link #residuals}, implemented by
 * subclasses).</li>
 * <li>Score residuals against a leave-one-out baseline
 * ({@link BaselineScorer}).</li>
 * <li>Merge anomalous readings no more than {@code patternMergeGap} apart into
 * patterns, score their confidence, drop patterns below the sensitivity
 * floor.</li>
 * </ol>
 *
 * <p>
 * Instances hold only immutable configuration and are safe for concurrent
 * use.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AbstractBaselineDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractBaselineDetector.class);

    /** Points between two cancellation checks inside the filtering loop. */
    static final int CANCELLATION_CHECK_INTERVAL = 1024;

    protected final DetectorConfig config;
    private final Clock clock;

    /**
     * @param config validated detector configuration
     * @param clock  clock stamping {@code detectedAt}
     * @throws NullPointerException if an argument is {@code null}
     */
    protected AbstractBaselineDetector(DetectorConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Compute the series the baseline is fitted to.
     *
     * @param series      readings of one sensor
     * @param granularity seasonal bucket resolution
     * @return residual of every reading, in sensor units
     */
    protected abstract double[] residuals(SensorSeries series, Granularity granularity);

    @Override
    public final DetectionResult detectAnomalies(List<TimeSeriesPoint> points, AnalysisWindow window,
            CancellationToken cancellation) {
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(cancellation, "cancellation token must not be null");

        if (points.isEmpty()) {
            LOG.warn("Anomaly detection called with no data points");
            return DetectionResult.failure(EngineError.of(ErrorType.EMPTY_DATASET, "No data points provided"));
        }
        try {
            return analyze(points, window, cancellation);
        } catch (RuntimeException e) {
            LOG.error("Anomaly detection failed for {} point(s)", points.size(), e);
            return DetectionResult.failure(EngineError.of(ErrorType.ANALYSIS_FAILED,
                    "Anomaly detection failed: " + e.getMessage()));
        }
    }

    @Override
    public DetectorConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    private DetectionResult analyze(List<TimeSeriesPoint> points, AnalysisWindow window,
            CancellationToken cancellation) {
        long started = System.nanoTime();
        Instant from = window.effectiveStart(config.getLookbackPeriod());
        Instant to = window.getEndTime();

        Map<String, List<TimeSeriesPoint>> bySensor = new LinkedHashMap<>();
        int inWindow = 0;
        int skipped = 0;
        int outside = 0;
        for (int i = 0; i < points.size(); i++) {
            if (i % CANCELLATION_CHECK_INTERVAL == 0 && cancellation.isCancellationRequested()) {
                return cancelled();
            }
            TimeSeriesPoint point = points.get(i);
            Instant ts = point.getTimestamp();
            if (ts.isBefore(from) || ts.isAfter(to)) {
                outside++;
                continue;
            }
            if (!Double.isFinite(point.getValue())) {
                skipped++;
                continue;
            }
            inWindow++;
            bySensor.computeIfAbsent(point.getSensorId(), k -> new ArrayList<>()).add(point);
        }

        if (outside > 0 && from.isAfter(window.getStartTime())) {
            LOG.warn("Lookback {} narrowed the {} window to start at {}; {} point(s) outside it were ignored",
                    config.getLookbackPeriod(), window.getDuration(), from, outside);
        }

        int minimum = config.getMinimumDataPoints();
        if (inWindow < minimum) {
            LOG.warn("Insufficient data: {} point(s) in window, {} required", inWindow, minimum);
            return DetectionResult.failure(EngineError.of(ErrorType.INSUFFICIENT_DATA,
                    "Insufficient data points. Required: " + minimum + ", provided: " + inWindow));
        }

        Instant detectedAt = clock.instant();
        StatisticalSummary.Builder summary = StatisticalSummary.builder()
                .pointsSkipped(skipped)
                .pointsOutsideWindow(outside);
        List<DetectedPattern> patterns = new ArrayList<>();
        int analyzedPoints = 0;
        int sensorsAnalyzed = 0;
        int sensorsSkipped = 0;
        int anomalies = 0;
        int suppressed = 0;

        for (Map.Entry<String, List<TimeSeriesPoint>> entry : bySensor.entrySet()) {
            if (cancellation.isCancellationRequested()) {
                return cancelled();
            }
            List<TimeSeriesPoint> sensorPoints = entry.getValue();
            if (sensorPoints.size() < minimum) {
                LOG.debug("Skipping sensor {}: {} point(s), {} required",
                        entry.getKey(), sensorPoints.size(), minimum);
                sensorsSkipped++;
                continue;
            }
            SensorSeries series = SensorSeries.of(entry.getKey(), sensorPoints);
            sensorsAnalyzed++;
            analyzedPoints += series.size();

            for (DetectedPattern pattern : detectPatterns(series, window.getGranularity(), detectedAt)) {
                if (pattern.getConfidenceScore() < config.reportingConfidenceFloor()) {
                    suppressed++;
                    continue;
                }
                patterns.add(pattern);
                anomalies += pattern.getDataPoints().size();
                summary.recordConfidence(pattern.getConfidenceScore());
            }
        }

        patterns.sort(Comparator.comparing(DetectedPattern::getStartTime)
                .thenComparing(DetectedPattern::getPatternId));

        long elapsed = System.nanoTime() - started;
        summary.pointsAnalyzed(analyzedPoints)
                .sensorsAnalyzed(sensorsAnalyzed)
                .sensorsSkipped(sensorsSkipped)
                .anomaliesDetected(anomalies)
                .patternsSuppressed(suppressed)
                .processingTimeMs(elapsed / 1_000_000L);

        LOG.info("Detected {} pattern(s) across {} sensor(s) from {} point(s) in {} ms",
                patterns.size(), sensorsAnalyzed, analyzedPoints, elapsed / 1_000_000L);
        return DetectionResult.success(patterns, summary.build(),
                PerformanceMetrics.of(analyzedPoints, elapsed));
    }

    private List<DetectedPattern> detectPatterns(SensorSeries series, Granularity granularity,
            Instant detectedAt) {
        double threshold = config.getThresholdMultiplier();
        double[] values = series.values();
        double[] residuals = residuals(series, granularity);
        BaselineScorer.Scores scores = BaselineScorer.score(residuals, threshold, config.getOutlierHandling());

        List<DetectedPattern> patterns = new ArrayList<>();
        int groupStart = -1;
        int last = -1;
        for (int i = 0; i < values.length; i++) {
            if (Math.abs(scores.z[i]) <= threshold) {
                continue;
            }
            if (groupStart >= 0 && i - last > config.getPatternMergeGap()) {
                patterns.add(buildPattern(series, residuals, scores, groupStart, last, detectedAt));
                groupStart = -1;
            }
            if (groupStart < 0) {
                groupStart = i;
            }
            last = i;
        }
        if (groupStart >= 0) {
            patterns.add(buildPattern(series, residuals, scores, groupStart, last, detectedAt));
        }
        return patterns;
    }

    private DetectedPattern buildPattern(SensorSeries series, double[] residuals,
            BaselineScorer.Scores scores, int from, int to, Instant detectedAt) {
        double threshold = config.getThresholdMultiplier();
        List<DataPoint> dataPoints = new ArrayList<>();
        List<Double> groupZ = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            double z = scores.z[i];
            if (Math.abs(z) <= threshold) {
                continue;
            }
            double value = series.values()[i];
            double expected = value - residuals[i] + scores.baselineMean[i];
            dataPoints.add(new DataPoint(series.timestamps()[i], value, expected, Math.abs(z)));
            groupZ.add(z);
        }

        double[] z = groupZ.stream().mapToDouble(Double::doubleValue).toArray();
        double peakSigned = z[ConfidenceScorer.peakIndex(z)];
        double peak = Math.abs(peakSigned);
        double confidence = ConfidenceScorer.confidence(z, threshold, config.getConfidenceMethod());
        Instant start = dataPoints.get(0).getTimestamp();

        String description = String.format(Locale.ROOT,
                "%s %s on sensor %s%s: %d anomalous reading(s), peak %.1f sigma",
                series.equipmentType().getLabel(),
                peakSigned > 0 ? "spike" : "drop",
                series.sensorId(),
                series.floorNumber() != null ? " (floor " + series.floorNumber() + ")" : "",
                dataPoints.size(), peak);

        DetectedPattern pattern = DetectedPattern.builder()
                .patternId("pattern_" + series.sensorId() + "_" + start.toEpochMilli())
                .sensorId(series.sensorId())
                .equipmentType(series.equipmentType())
                .floorNumber(series.floorNumber())
                .confidenceScore(confidence)
                .severity(ConfidenceScorer.severity(peak, threshold, confidence))
                .dataPoints(dataPoints)
                .detectedAt(detectedAt)
                .detectionAlgorithm(getAlgorithmType().getValue())
                .description(description)
                .build();
        LOG.debug("Pattern {}: confidence={}, severity={}, points={}",
                pattern.getPatternId(), confidence, pattern.getSeverity(), dataPoints.size());
        return pattern;
    }

    /**
     * Bucket index of every reading of the series in the configured zone.
     */
    protected int[] buckets(SensorSeries series, Granularity granularity) {
        Instant[] timestamps = series.timestamps();
        int[] buckets = new int[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            buckets[i] = granularity.bucketOf(timestamps[i], config.getTimeZone());
        }
        return buckets;
    }

    /**
     * Cycle index of every reading of the series in the configured zone.
     */
    protected long[] cycles(SensorSeries series, Granularity granularity) {
        Instant[] timestamps = series.timestamps();
        long[] cycles = new long[timestamps.length];
        for (int i = 0; i < timestamps.length; i++) {
            cycles[i] = granularity.cycleOf(timestamps[i], config.getTimeZone());
        }
        return cycles;
    }

    private static DetectionResult cancelled() {
        LOG.info("Anomaly detection cancelled");
        return DetectionResult.failure(EngineError.of(ErrorType.CANCELLED, "Anomaly detection cancelled"));
    }
}
