package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.DetectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances from a
 * {@link DetectorConfig}.
 *
 * <p>
 * The switch over {@link com.failuresentinel.core.config.AlgorithmType} has
 * no default branch, so adding an algorithm without a detector is a compile
 * error.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given configuration using the system clock.
     *
     * @param config validated detector configuration; must not be {@code null}
     * @return an appropriate {@link AnomalyDetector} instance
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public static AnomalyDetector create(DetectorConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Create a detector whose {@code detectedAt} timestamps come from
     * {@code clock}.
     *
     * @param config validated detector configuration; must not be {@code null}
     * @param clock  clock stamping detected patterns; must not be {@code null}
     * @return an appropriate {@link AnomalyDetector} instance
     */
    public static AnomalyDetector create(DetectorConfig config, Clock clock) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");

        LOG.debug("Creating {} detector", config.getAlgorithmType().getValue());
        return switch (config.getAlgorithmType()) {
            case STATISTICAL_ZSCORE -> new ZScoreAnomalyDetector(config, clock);
            case SEASONAL_DECOMPOSITION -> new SeasonalDecompositionDetector(config, clock);
        };
    }
}
