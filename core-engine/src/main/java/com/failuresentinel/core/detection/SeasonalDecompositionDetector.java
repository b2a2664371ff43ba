package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.AlgorithmType;
import com.failuresentinel.core.config.DetectorConfig;
import com.failuresentinel.core.model.Granularity;
import com.failuresentinel.core.util.Statistics;

import java.time.Clock;
import java.time.Instant;

/**
 * Detector that decomposes each series into trend, seasonal component and
 * residual before scoring the residual.
 *
 * <h3>Decomposition</h3>
 * <ol>
 * <li>Fit a least-squares linear trend against elapsed hours.</li>
 * <li>Fit the seasonal profile to the detrended values.</li>
 * <li>Refit the trend to the deseasonalised values and refit the profile,
 * {@value #REFINEMENT_PASSES} times in total. A cyclic component leaks into a
 * single straight-line fit; the refits remove most of that leak.</li>
 * </ol>
 *
 * <p>
 * The seasonal step always runs here, independently of
 * {@code seasonalAdjustment}; it is still skipped when a bucket is covered by
 * too few days (or weeks).
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDecompositionDetector extends AbstractBaselineDetector {

    static final int REFINEMENT_PASSES = 3;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    public SeasonalDecompositionDetector(DetectorConfig config) {
        this(config, Clock.systemUTC());
    }

    public SeasonalDecompositionDetector(DetectorConfig config, Clock clock) {
        super(config, clock);
    }

    @Override
    protected double[] residuals(SensorSeries series, Granularity granularity) {
        double[] values = series.values();
        double[] hours = elapsedHours(series.timestamps());
        int[] buckets = buckets(series, granularity);
        long[] cycles = cycles(series, granularity);

        double[] deseasonalised = values;
        SeasonalProfile profile = null;
        double[] detrended = values;
        for (int pass = 0; pass < REFINEMENT_PASSES; pass++) {
            detrended = removeTrend(values, deseasonalised, hours);
            profile = SeasonalProfile.fit(detrended, buckets, cycles, granularity.getBucketCount());
            if (!profile.isApplied()) {
                return detrended;
            }
            deseasonalised = profile.remove(values, buckets);
        }
        return profile.remove(detrended, buckets);
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.SEASONAL_DECOMPOSITION;
    }

    /**
     * @param values  series to detrend
     * @param fitOn   series the trend line is fitted to
     * @param hours   elapsed hours of every reading
     * @return {@code values} minus the fitted line
     */
    private static double[] removeTrend(double[] values, double[] fitOn, double[] hours) {
        double slope = Statistics.slope(hours, fitOn);
        double intercept = Statistics.mean(fitOn) - slope * Statistics.mean(hours);
        double[] detrended = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            detrended[i] = values[i] - (intercept + slope * hours[i]);
        }
        return detrended;
    }

    private static double[] elapsedHours(Instant[] timestamps) {
        double[] hours = new double[timestamps.length];
        long origin = timestamps[0].toEpochMilli();
        for (int i = 0; i < timestamps.length; i++) {
            hours[i] = (timestamps[i].toEpochMilli() - origin) / MILLIS_PER_HOUR;
        }
        return hours;
    }
}
