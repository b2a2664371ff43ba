package com.failuresentinel.core.detection;

import com.failuresentinel.core.config.AlgorithmType;
import com.failuresentinel.core.config.DetectorConfig;
import com.failuresentinel.core.model.DataPoint;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.model.TimeSeriesPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.failuresentinel.core.detection.ZScoreAnomalyDetectorTest.hour;
import static com.failuresentinel.core.detection.ZScoreAnomalyDetectorTest.hourly;
import static com.failuresentinel.core.detection.ZScoreAnomalyDetectorTest.noise;
import static com.failuresentinel.core.detection.ZScoreAnomalyDetectorTest.window;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeasonalDecompositionDetector}.
 */
class SeasonalDecompositionDetectorTest {

    private DetectorConfig config;
    private List<TimeSeriesPoint> trendingSeries;

    @BeforeEach
    void setUp() {
        config = DetectorConfig.builder()
                .algorithmType(AlgorithmType.SEASONAL_DECOMPOSITION)
                .lookbackPeriod(Duration.ofHours(72))
                .build();
        // rising load with a daily cycle and one spike on the second day
        trendingSeries = hourly("hvac-7", 72,
                i -> 100 + 0.5 * i + 20 * Math.sin(2 * Math.PI * i / 24) + noise(i) + (i == 42 ? 25 : 0));
    }

    @Test
    @DisplayName("Should isolate the spike from trend and daily cycle")
    void shouldDetectSpikeOnTrendingSeries() {
        DetectionResult result = new SeasonalDecompositionDetector(config)
                .detectAnomalies(trendingSeries, window(72));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPatterns()).hasSize(1);
        DetectedPattern pattern = result.getPatterns().get(0);
        assertThat(pattern.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(pattern.getDetectionAlgorithm()).isEqualTo("seasonal_decomposition");
        assertThat(pattern.getDataPoints()).extracting(DataPoint::getTimestamp).containsExactly(hour(42));
    }

    @Test
    @DisplayName("Plain z-score scoring should not flag the trending spike as critical")
    void shouldNotBeCriticalWithoutDetrending() {
        DetectionResult result = new ZScoreAnomalyDetector(config.toBuilder()
                .algorithmType(AlgorithmType.STATISTICAL_ZSCORE)
                .build())
                .detectAnomalies(trendingSeries, window(72));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPatterns()).noneMatch(p -> p.getSeverity() == Severity.CRITICAL);
    }

    @Test
    @DisplayName("Should detrend without a seasonal profile when buckets are too sparse")
    void shouldFallBackToTrendOnlyForShortSeries() {
        List<TimeSeriesPoint> points = hourly("hvac-7", 24,
                i -> 100 + 2.0 * i + noise(i) + (i == 14 ? 12 : 0));

        DetectionResult result = new SeasonalDecompositionDetector(config).detectAnomalies(points, window(24));

        assertThat(result.getPatterns()).hasSize(1);
        Instant spikeAt = hour(14);
        assertThat(result.getPatterns().get(0).getStartTime()).isEqualTo(spikeAt);
        assertThat(result.getPatterns().get(0).getDataPoints().get(0).getExpectedValue())
                .isBetween(125.0, 131.0);
    }
}
