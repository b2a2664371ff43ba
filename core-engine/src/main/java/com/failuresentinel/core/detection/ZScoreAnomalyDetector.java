package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.AlgorithmType;
import com.failuresentinel.core.config.DetectorConfig;
import com.failuresentinel.core.model.Granularity;

import java.time.Clock;

/**
 * Z-score detector.
 *
 * <p>
 * With {@code seasonalAdjustment} enabled, the per-bucket seasonal component
 * (hour of day, 15-minute slot or day of week, depending on the window's
 * granularity) is removed before scoring so predictable cyclic load is not
 * flagged. Without it the raw readings are scored.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAnomalyDetector extends AbstractBaselineDetector {

    public ZScoreAnomalyDetector(DetectorConfig config) {
        this(config, Clock.systemUTC());
    }

    public ZScoreAnomalyDetector(DetectorConfig config, Clock clock) {
        super(config, clock);
    }

    @Override
    protected double[] residuals(SensorSeries series, Granularity granularity) {
        if (!config.isSeasonalAdjustment()) {
            return series.values();
        }
        int[] buckets = buckets(series, granularity);
        return SeasonalProfile.fit(series.values(), buckets, cycles(series, granularity),
                granularity.getBucketCount())
                .remove(series.values(), buckets);
    }

    @Override
    public AlgorithmType getAlgorithmType() {
        return AlgorithmType.STATISTICAL_ZSCORE;
    }
}
