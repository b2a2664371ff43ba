package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.AlgorithmType;
import com.failuresentinel.core.config.DetectorConfig;
import com.failuresentinel.core.model.AnalysisWindow;
import com.failuresentinel.core.model.TimeSeriesPoint;
import com.failuresentinel.core.util.CancellationToken;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong> apart from their immutable
 * {@link DetectorConfig}: every call recomputes baselines from the supplied
 * points, so one instance may be shared across threads.
 * </p>
 * <p>
 * Data problems (no points, too few points, cancellation) are reported as a
 * failed {@link DetectionResult}, never thrown.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Detect anomalous patterns in the given readings.
     *
     * @param points       sensor readings, in any order; must not be
     *                     {@code null}
     * @param window       analysis window; must not be {@code null}
     * @param cancellation cooperative cancellation token; must not be
     *                     {@code null}
     * @return the detection outcome
     * @throws NullPointerException if an argument is {@code null}
     */
    DetectionResult detectAnomalies(List<TimeSeriesPoint> points, AnalysisWindow window,
            CancellationToken cancellation);

    /**
     * Same as {@link #detectAnomalies(List, AnalysisWindow, CancellationToken)}
     * without cancellation.
     */
    default DetectionResult detectAnomalies(List<TimeSeriesPoint> points, AnalysisWindow window) {
        return detectAnomalies(points, window, CancellationToken.none());
    }

    AlgorithmType getAlgorithmType();

    DetectorConfig getConfig();
}
