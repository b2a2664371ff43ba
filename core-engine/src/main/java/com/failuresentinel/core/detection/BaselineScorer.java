package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.OutlierHandling;
import com.failuresentinel.core.util.Statistics;

/**
 * Scores a residual series against a leave-one-out baseline.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Pass 1: for every point, mean and sample standard deviation of all
 * <em>other</em> points, from running sums. Points with
 * {@code |z| > threshold} are flagged.</li>
 * <li>Pass 2 depends on {@link OutlierHandling}: {@code CAP} clips flagged
 * values to {@code mean ± threshold·sd} and re-baselines, {@code REMOVE}
 * drops them from the baseline, {@code FLAG} keeps pass 1.</li>
 * </ol>
 *
 * <p>
 * Both passes are linear. Values are centred on their median before the sums
 * are accumulated to limit cancellation on large sensor readings.
 * </p>
 */
final class BaselineScorer {

    /** Largest reported {@code |z|}. */
    static final double MAX_ABS_Z = 100.0;

    private static final double SD_FLOOR_FACTOR = 1e-9;

    private BaselineScorer() {
        // utility class, not instantiable
    }

    /**
     * Scored residual series.
     */
    static final class Scores {
        final double[] z;
        final double[] baselineMean;
        final double[] baselineSd;

        private Scores(int n) {
            this.z = new double[n];
            this.baselineMean = new double[n];
            this.baselineSd = new double[n];
        }
    }

    /**
     * @param residuals series to score
     * @param threshold anomaly threshold on {@code |z|}
     * @param handling  treatment of pass 1 outliers
     * @return signed z-scores and the baseline mean of every point, in
     *         residual units
     */
    static Scores score(double[] residuals, double threshold, OutlierHandling handling) {
        int n = residuals.length;
        double shift = Statistics.median(residuals, n);
        double[] centred = new double[n];
        for (int i = 0; i < n; i++) {
            centred[i] = residuals[i] - shift;
        }

        Scores first = leaveOneOut(centred, centred, null, shift);
        boolean[] flagged = new boolean[n];
        int flaggedCount = 0;
        for (int i = 0; i < n; i++) {
            flagged[i] = Math.abs(first.z[i]) > threshold;
            if (flagged[i]) {
                flaggedCount++;
            }
        }

        Scores result = switch (handling) {
            case FLAG -> first;
            case CAP -> {
                if (flaggedCount == 0) {
                    yield first;
                }
                double[] capped = centred.clone();
                for (int i = 0; i < n; i++) {
                    if (flagged[i]) {
                        double limit = threshold * first.baselineSd[i];
                        capped[i] = Statistics.clamp(centred[i],
                                first.baselineMean[i] - limit, first.baselineMean[i] + limit);
                    }
                }
                yield leaveOneOut(capped, centred, null, shift);
            }
            case REMOVE -> {
                if (flaggedCount == 0 || n - flaggedCount < 3) {
                    yield first;
                }
                boolean[] include = new boolean[n];
                for (int i = 0; i < n; i++) {
                    include[i] = !flagged[i];
                }
                yield leaveOneOut(centred, centred, include, shift);
            }
        };

        for (int i = 0; i < n; i++) {
            result.baselineMean[i] += shift;
        }
        return result;
    }

    /**
     * @param baseline values contributing to the baseline
     * @param scored   values being scored
     * @param include  baseline membership, {@code null} for all points
     * @param shift    centring offset, used for the standard deviation floor
     */
    private static Scores leaveOneOut(double[] baseline, double[] scored, boolean[] include, double shift) {
        int n = baseline.length;
        double sum = 0;
        double sumSq = 0;
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (include == null || include[i]) {
                sum += baseline[i];
                sumSq += baseline[i] * baseline[i];
                count++;
            }
        }

        Scores scores = new Scores(n);
        for (int i = 0; i < n; i++) {
            double s = sum;
            double sq = sumSq;
            int c = count;
            if (include == null || include[i]) {
                s -= baseline[i];
                sq -= baseline[i] * baseline[i];
                c--;
            }
            if (c < 2) {
                // no usable baseline, never anomalous
                scores.baselineMean[i] = c == 1 ? s : scored[i];
                scores.baselineSd[i] = 0.0;
                scores.z[i] = 0.0;
                continue;
            }
            double mean = s / c;
            double variance = Math.max(0.0, (sq - c * mean * mean) / (c - 1));
            double sd = Math.max(Math.sqrt(variance),
                    SD_FLOOR_FACTOR * Math.max(1.0, Math.abs(mean + shift)));
            scores.baselineMean[i] = mean;
            scores.baselineSd[i] = sd;
            scores.z[i] = Statistics.clamp((scored[i] - mean) / sd, -MAX_ABS_Z, MAX_ABS_Z);
        }
        return scores;
    }
}
