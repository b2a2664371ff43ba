package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.ConfidenceMethod;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.util.Statistics;

/**
 * Confidence and coarse severity of a group of anomalous readings.
 *
 * <h3>Statistical confidence</h3>
 * <p>
 * A logistic curve centred on the threshold,
 * {@code 100 / (1 + e^(-2(|z_peak| - threshold)))}, plus a corroboration
 * bonus of {@code min(10, 4(k - 1))} for {@code k} anomalous readings.
 * </p>
 *
 * <h3>Ensemble confidence</h3>
 * <p>
 * {@code 0.7 · statistical + 0.3 · shape}, where the shape score rewards
 * readings that deviate in the same direction as the peak (weight 0.4),
 * patterns of three or more readings (0.3) and peaks of twice the threshold
 * (0.3).
 * </p>
 */
final class ConfidenceScorer {

    static final double STATISTICAL_WEIGHT = 0.7;
    static final double SHAPE_WEIGHT = 0.3;

    private ConfidenceScorer() {
        // utility class, not instantiable
    }

    /**
     * @param z         signed z-scores of the anomalous readings, non-empty
     * @param threshold anomaly threshold
     * @param method    confidence method
     * @return confidence in {@code [0, 100]}, rounded to one decimal
     */
    static double confidence(double[] z, double threshold, ConfidenceMethod method) {
        int peakIndex = peakIndex(z);
        double peak = Math.abs(z[peakIndex]);
        int k = z.length;

        double statistical = 100.0 / (1.0 + Math.exp(-2.0 * (peak - threshold)))
                + Math.min(10.0, 4.0 * (k - 1));

        double combined = switch (method) {
            case STATISTICAL -> statistical;
            case ENSEMBLE -> {
                double sign = Math.signum(z[peakIndex]);
                int sameDirection = 0;
                for (double value : z) {
                    if (Math.signum(value) == sign) {
                        sameDirection++;
                    }
                }
                double directionConsistency = (double) sameDirection / k;
                double shape = 100.0 * (0.4 * directionConsistency
                        + 0.3 * Math.min(1.0, k / 3.0)
                        + 0.3 * Math.min(1.0, peak / (2.0 * threshold)));
                yield STATISTICAL_WEIGHT * Math.min(100.0, statistical) + SHAPE_WEIGHT * shape;
            }
        };
        return Statistics.round1(Statistics.clamp(combined, 0.0, 100.0));
    }

    /**
     * Coarse detection-time severity from the peak-to-threshold ratio and the
     * confidence.
     */
    static Severity severity(double peak, double threshold, double confidence) {
        double ratio = peak / threshold;
        if (ratio >= 2.0 && confidence >= 90.0) {
            return Severity.CRITICAL;
        }
        if (ratio >= 1.5 || confidence >= 75.0) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    static int peakIndex(double[] z) {
        int peak = 0;
        for (int i = 1; i < z.length; i++) {
            if (Math.abs(z[i]) > Math.abs(z[peak])) {
                peak = i;
            }
        }
        return peak;
    }
}
