package com.failuresentinel.core.correlation;

import com.failuresentinel.core.config.CorrelationConfig;
import com.failuresentinel.core.model.DataPoint;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.ErrorType;
import com.failuresentinel.core.util.CancellationToken;
import com.failuresentinel.core.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Pairwise and lagged correlation between detected patterns.
 *
 * <h3>Timeline</h3>
 * <p>
 * Every pattern is reindexed onto a regular grid whose step is the smallest
 * positive spacing between any two data-point timestamps, widened when needed
 * so that no pair grid exceeds {@code maxGridSlots}. A slot holds the
 * pattern's severity score at that time, or 0.
 * </p>
 *
 * <h3>Pairs</h3>
 * <p>
 * Only patterns whose windows overlap (within {@code overlapToleranceMinutes})
 * are compared. Each pair gets its own grid spanning both windows, padded by
 * {@code maxLagSteps} empty slots on each side. The matrix entry is the
 * Pearson correlation at lag 0. The temporal entry is the best correlation
 * over lags {@code -maxLagSteps..maxLagSteps}; a positive lag means pattern B
 * follows pattern A.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternCorrelationAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PatternCorrelationAnalyzer.class);

    private static final double TIE_EPSILON = 1e-12;

    private final CorrelationConfig config;

    public PatternCorrelationAnalyzer() {
        this(new CorrelationConfig());
    }

    /**
     * @param config analyzer settings; validated here
     * @throws IllegalStateException if the settings are invalid
     */
    public PatternCorrelationAnalyzer(CorrelationConfig config) {
        this.config = Objects.requireNonNull(config, "CorrelationConfig must not be null");
        config.validate();
    }

    public CorrelationResult analyzeCorrelations(List<DetectedPattern> patterns) {
        return analyzeCorrelations(patterns, CancellationToken.none());
    }

    /**
     * Correlate every overlapping pair of patterns.
     *
     * @param patterns     patterns to correlate; each needs at least one data
     *                     point
     * @param cancellation cooperative cancellation token; must not be
     *                     {@code null}
     * @return the correlation outcome; {@code CORRELATION_INPUT_ERROR} for
     *         malformed input
     */
    public CorrelationResult analyzeCorrelations(List<DetectedPattern> patterns,
            CancellationToken cancellation) {
        Objects.requireNonNull(cancellation, "cancellation token must not be null");
        long started = System.nanoTime();

        String problem = inputProblem(patterns);
        if (problem != null) {
            LOG.warn("Rejecting correlation input: {}", problem);
            return CorrelationResult.failure(EngineError.of(ErrorType.CORRELATION_INPUT_ERROR, problem),
                    elapsedMs(started));
        }
        try {
            return correlate(patterns, cancellation, started);
        } catch (RuntimeException e) {
            LOG.error("Correlation analysis failed for {} pattern(s)", patterns.size(), e);
            return CorrelationResult.failure(EngineError.of(ErrorType.ANALYSIS_FAILED,
                    "Correlation analysis failed: " + e.getMessage()), elapsedMs(started));
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String inputProblem(List<DetectedPattern> patterns) {
        if (patterns == null) {
            return "Pattern list must not be null";
        }
        for (int i = 0; i < patterns.size(); i++) {
            DetectedPattern pattern = patterns.get(i);
            if (pattern == null) {
                return "Pattern at index " + i + " is null";
            }
            if (pattern.getDataPoints().isEmpty()) {
                return "Pattern " + pattern.getPatternId() + " has no data points";
            }
        }
        return null;
    }

    private CorrelationResult correlate(List<DetectedPattern> patterns, CancellationToken cancellation,
            long started) {
        int n = patterns.size();
        List<String> ids = patterns.stream().map(DetectedPattern::getPatternId).toList();
        Double[][] matrix = new Double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
        }
        if (n < 2) {
            return CorrelationResult.success(new CorrelationMatrix(ids, matrix), List.of(), List.of(),
                    elapsedMs(started));
        }

        long stepMillis = gridStepMillis(patterns);
        Duration tolerance = config.overlapTolerance();
        int maxLag = config.getMaxLagSteps();
        List<TemporalCorrelation> temporal = new ArrayList<>();
        Map<String, double[]> floorSums = new TreeMap<>();

        for (int i = 0; i < n; i++) {
            if (cancellation.isCancellationRequested()) {
                LOG.info("Correlation analysis cancelled");
                return CorrelationResult.failure(EngineError.of(ErrorType.CANCELLED,
                        "Correlation analysis cancelled"), elapsedMs(started));
            }
            DetectedPattern a = patterns.get(i);
            for (int j = i + 1; j < n; j++) {
                DetectedPattern b = patterns.get(j);
                if (!a.overlaps(b, tolerance)) {
                    continue;
                }
                Instant origin = earliest(a.getStartTime(), b.getStartTime()).minusMillis(maxLag * stepMillis);
                Instant end = latest(a.getEndTime(), b.getEndTime()).plusMillis(maxLag * stepMillis);
                int slots = (int) ((end.toEpochMilli() - origin.toEpochMilli()) / stepMillis) + 1;
                double[] seriesA = toGrid(a, origin, stepMillis, slots);
                double[] seriesB = toGrid(b, origin, stepMillis, slots);

                double r = Statistics.pearson(seriesA, seriesB, 0);
                matrix[i][j] = r;
                matrix[j][i] = r;

                int bestLag = 0;
                double best = r;
                for (int step = 1; step <= maxLag; step++) {
                    for (int lag : new int[] { step, -step }) {
                        double candidate = Statistics.pearson(seriesA, seriesB, lag);
                        if (candidate > best + TIE_EPSILON) {
                            best = candidate;
                            bestLag = lag;
                        }
                    }
                }
                if (best >= config.getMinCorrelation()) {
                    temporal.add(new TemporalCorrelation(a.getPatternId(), b.getPatternId(), bestLag,
                            Duration.ofMillis(bestLag * stepMillis), best));
                }
                accumulateFloors(floorSums, a, b, r);
            }
        }

        temporal.sort(Comparator.comparingDouble(TemporalCorrelation::getCorrelation).reversed()
                .thenComparing(TemporalCorrelation::getPatternIdA)
                .thenComparing(TemporalCorrelation::getPatternIdB));

        List<FloorCorrelation> floors = new ArrayList<>();
        for (double[] sums : floorSums.values()) {
            floors.add(new FloorCorrelation((int) sums[0], (int) sums[1], sums[2] / sums[3], (int) sums[3]));
        }
        floors.sort(Comparator.comparingInt(FloorCorrelation::getFloorA)
                .thenComparingInt(FloorCorrelation::getFloorB));

        long elapsed = elapsedMs(started);
        LOG.info("Correlated {} pattern(s): {} temporal correlation(s), {} floor pair(s) in {} ms",
                n, temporal.size(), floors.size(), elapsed);
        return CorrelationResult.success(new CorrelationMatrix(ids, matrix), temporal, floors, elapsed);
    }

    /**
     * Smallest positive spacing between distinct data-point timestamps,
     * widened so that a grid over the whole input fits {@code maxGridSlots}.
     */
    long gridStepMillis(List<DetectedPattern> patterns) {
        long[] times = patterns.stream()
                .flatMap(p -> p.getDataPoints().stream())
                .mapToLong(dp -> dp.getTimestamp().toEpochMilli())
                .sorted()
                .distinct()
                .toArray();
        long step = Long.MAX_VALUE;
        for (int i = 1; i < times.length; i++) {
            step = Math.min(step, times[i] - times[i - 1]);
        }
        if (step == Long.MAX_VALUE) {
            step = config.defaultStep().toMillis();
        }

        long minStart = patterns.stream().mapToLong(p -> p.getStartTime().toEpochMilli()).min().orElse(0L);
        long maxEnd = patterns.stream().mapToLong(p -> p.getEndTime().toEpochMilli()).max().orElse(0L);
        int usableSlots = config.getMaxGridSlots() - 2 * config.getMaxLagSteps() - 1;
        long span = maxEnd - minStart;
        if (span / step >= usableSlots) {
            long widened = span / usableSlots + 1;
            LOG.debug("Widening correlation grid step from {} ms to {} ms", step, widened);
            step = widened;
        }
        return step;
    }

    private static double[] toGrid(DetectedPattern pattern, Instant origin, long stepMillis, int slots) {
        double[] grid = new double[slots];
        long originMillis = origin.toEpochMilli();
        for (DataPoint point : pattern.getDataPoints()) {
            int slot = (int) ((point.getTimestamp().toEpochMilli() - originMillis) / stepMillis);
            if (slot >= 0 && slot < slots) {
                grid[slot] = Math.max(grid[slot], point.getSeverityScore());
            }
        }
        return grid;
    }

    private static void accumulateFloors(Map<String, double[]> floorSums, DetectedPattern a, DetectedPattern b,
            double r) {
        if (a.getFloorNumber() == null || b.getFloorNumber() == null) {
            return;
        }
        int low = Math.min(a.getFloorNumber(), b.getFloorNumber());
        int high = Math.max(a.getFloorNumber(), b.getFloorNumber());
        String key = String.format("%06d-%06d", low, high);
        double[] sums = floorSums.computeIfAbsent(key, k -> new double[] { low, high, 0.0, 0.0 });
        sums[2] += r;
        sums[3] += 1;
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
