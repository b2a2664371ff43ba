package com.failuresentinel.pipeline;

import com.failuresentinel.core.classification.ClassificationResult;
import com.failuresentinel.core.classification.PatternClassifier;
import com.failuresentinel.core.config.EngineConfig;
import com.failuresentinel.core.correlation.CorrelationResult;
import com.failuresentinel.core.correlation.PatternCorrelationAnalyzer;
import com.failuresentinel.core.correlation.TemporalCorrelation;
import com.failuresentinel.core.detection.DetectorFactory;
import com.failuresentinel.core.model.AnalysisWindow;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EquipmentContext;
import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.ErrorType;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.model.TimeSeriesPoint;
import com.failuresentinel.core.recommendation.RecommendationEngine;
import com.failuresentinel.core.util.CancellationToken;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FailurePatternPipeline}.
 *
 * <p>
 * The building has one HVAC sensor per floor, 48 hourly readings each. Floors
 * 5 and 7 spike together at hours 30-32, floor 6 one hour later.
 * </p>
 */
class FailurePatternPipelineTest {

    private static final Instant BASE = Instant.parse("2024-03-04T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-06T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final int FLOORS = 7;
    private static final int HOURS = 48;

    private SimpleMeterRegistry registry;
    private EngineConfig engineConfig;
    private List<NotificationPayload> dispatched;
    private List<byte[]> dispatchedJson;
    private FailurePatternPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        engineConfig = new EngineConfig();
        engineConfig.getDetector().setLookbackHours(HOURS);
        dispatched = new CopyOnWriteArrayList<>();
        dispatchedJson = new CopyOnWriteArrayList<>();
        pipeline = new FailurePatternPipeline(engineConfig, PipelineConfig.defaults(),
                (payload, json) -> {
                    dispatched.add(payload);
                    dispatchedJson.add(json);
                }, registry, CLOCK);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    @DisplayName("Should detect, classify, correlate, recommend and notify across floors")
    void shouldRunAllStages() {
        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStageFailures()).isEmpty();

        List<DetectedPattern> patterns = result.getDetection().getPatterns();
        assertThat(patterns).extracting(DetectedPattern::getFloorNumber).containsExactly(5, 7, 6);
        assertThat(patterns).allSatisfy(p -> {
            assertThat(p.getSeverity()).isEqualTo(Severity.CRITICAL);
            assertThat(p.getDataPoints()).hasSize(3);
            assertThat(p.getDetectedAt()).isEqualTo(NOW);
        });

        assertThat(result.getClassifications()).hasSize(3)
                .extracting(ClassificationResult::getSeverity)
                .containsOnly(Severity.CRITICAL);
        assertThat(result.getRecommendations()).hasSize(3)
                .allSatisfy(entry -> assertThat(entry.getRecommendations()).isNotEmpty());
    }

    @Test
    @DisplayName("Should report the floor cascade as lagged correlations")
    void shouldCorrelateFloorCascade() {
        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        CorrelationResult correlation = result.getCorrelation().orElseThrow();
        assertThat(correlation.isSuccess()).isTrue();

        String p5 = patternOnFloor(result, 5);
        String p6 = patternOnFloor(result, 6);
        String p7 = patternOnFloor(result, 7);

        TemporalCorrelation together = temporal(correlation, p5, p7);
        assertThat(together.getLag()).isZero();
        assertThat(together.getCorrelation()).isCloseTo(1.0, within(1e-9));

        TemporalCorrelation cascade = temporal(correlation, p5, p6);
        assertThat(cascade.getLag()).isEqualTo(1);
        assertThat(cascade.getLagDuration()).isEqualTo(Duration.ofHours(1));
        assertThat(cascade.getCorrelation()).isGreaterThan(0.9);
        assertThat(temporal(correlation, p7, p6).getLag()).isEqualTo(1);

        assertThat(correlation.getFloorCorrelations()).hasSize(3)
                .allSatisfy(f -> assertThat(f.getMeanCorrelation()).isNotZero());
    }

    @Test
    @DisplayName("Should dispatch one JSON notification per critical pattern")
    void shouldDispatchNotifications() {
        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(result.getNotifications()).hasSize(3);
        assertThat(dispatched).hasSize(3);
        assertThat(dispatched).allSatisfy(payload -> {
            assertThat(payload.getClassification()).isNotNull();
            assertThat(payload.getRecommendations()).isNotEmpty();
            assertThat(payload.getGeneratedAt()).isEqualTo(NOW);
        });
        assertThat(dispatchedJson).allSatisfy(json -> assertThat(json).isNotEmpty());
        assertThat(counter(PipelineMetrics.NOTIFICATIONS_DISPATCHED)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should record throughput and latency metrics")
    void shouldRecordMetrics() {
        pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(counter(PipelineMetrics.POINTS_PROCESSED)).isEqualTo(FLOORS * HOURS);
        assertThat(counter(PipelineMetrics.PATTERNS_DETECTED)).isEqualTo(3.0);
        assertThat(registry.get(PipelineMetrics.PIPELINE_LATENCY).timer().count()).isEqualTo(1);
        assertThat(registry.get(PipelineMetrics.STAGE_FAILURES).counters())
                .allSatisfy(c -> assertThat(c.count()).isZero());
    }

    @Test
    @DisplayName("Failed detection should skip the downstream stages")
    void shouldSkipDownstreamStagesWhenDetectionFails() {
        PipelineResult result = pipeline.run(List.of(), window(), EquipmentContext.builder().build());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.hasFailed(PipelineStage.DETECTION)).isTrue();
        assertThat(result.getStageFailures()).singleElement()
                .satisfies(f -> assertThat(f.getErrorType()).isEqualTo(ErrorType.EMPTY_DATASET));
        assertThat(result.getClassifications()).isEmpty();
        assertThat(result.getCorrelation()).isEmpty();
        assertThat(result.getRecommendations()).isEmpty();
        assertThat(result.getNotifications()).isEmpty();
        assertThat(dispatched).isEmpty();
        assertThat(registry.get(PipelineMetrics.STAGE_FAILURES).tag("stage", "detection").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A failing stage should not stop the others")
    void shouldIsolateStageFailure() {
        PatternClassifier broken = new PatternClassifier() {
            @Override
            public List<ClassificationResult> classifyPatterns(List<DetectedPattern> patterns) {
                throw new IllegalStateException("classifier offline");
            }
        };
        pipeline.close();
        pipeline = new FailurePatternPipeline(PipelineConfig.defaults(),
                DetectorFactory.create(engineConfig.detectorConfig(), CLOCK), broken,
                new PatternCorrelationAnalyzer(), new RecommendationEngine(), (payload, json) -> dispatched.add(payload),
                new PipelineMetrics(registry), CLOCK);

        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(result.hasFailed(PipelineStage.CLASSIFICATION)).isTrue();
        assertThat(result.getStageFailures()).singleElement().satisfies(f -> {
            assertThat(f.getErrorType()).isEqualTo(ErrorType.ANALYSIS_FAILED);
            assertThat(f.getMessage()).contains("classifier offline");
        });
        assertThat(result.getClassifications()).isEmpty();
        assertThat(result.getCorrelation()).hasValueSatisfying(c -> assertThat(c.isSuccess()).isTrue());
        assertThat(result.getRecommendations()).hasSize(3);
        // detection severity still drives notifications
        assertThat(result.getNotifications()).hasSize(3)
                .allSatisfy(payload -> assertThat(payload.getClassification()).isNull());
    }

    @Test
    @DisplayName("Cancellation while the concurrent stages run should return no partial output")
    void shouldDiscardOutputWhenCancelledAfterDetection() {
        CancellationToken token = CancellationToken.create();
        PatternClassifier cancelling = new PatternClassifier() {
            @Override
            public List<ClassificationResult> classifyPatterns(List<DetectedPattern> patterns) {
                token.cancel();
                return super.classifyPatterns(patterns);
            }
        };
        pipeline.close();
        pipeline = new FailurePatternPipeline(PipelineConfig.defaults(),
                DetectorFactory.create(engineConfig.detectorConfig(), CLOCK), cancelling,
                new PatternCorrelationAnalyzer(), new RecommendationEngine(), (payload, json) -> dispatched.add(payload),
                new PipelineMetrics(registry), CLOCK);

        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build(), token);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getStageFailures()).anySatisfy(f -> {
            assertThat(f.getStage()).isEqualTo(PipelineStage.NOTIFICATION);
            assertThat(f.getErrorType()).isEqualTo(ErrorType.CANCELLED);
        });
        assertThat(result.getDetection().isSuccess()).isFalse();
        assertThat(result.getDetection().getPatterns()).isEmpty();
        assertThat(result.getClassifications()).isEmpty();
        assertThat(result.getCorrelation()).isEmpty();
        assertThat(result.getRecommendations()).isEmpty();
        assertThat(result.getNotifications()).isEmpty();
        assertThat(dispatched).isEmpty();
    }

    @Test
    @DisplayName("Cancellation requested before the run should stop it without output")
    void shouldStopWhenCancelledBeforeRun() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build(), token);

        assertThat(result.getStageFailures()).singleElement()
                .satisfies(f -> assertThat(f.getErrorType()).isEqualTo(ErrorType.CANCELLED));
        assertThat(result.getDetection().getPatterns()).isEmpty();
        assertThat(result.getNotifications()).isEmpty();
        assertThat(dispatched).isEmpty();
    }

    @Test
    @DisplayName("Dispatcher errors should be recorded per pattern")
    void shouldRecordDispatchFailures() {
        pipeline.close();
        pipeline = new FailurePatternPipeline(engineConfig, PipelineConfig.defaults(),
                (payload, json) -> {
                    throw new IllegalStateException("channel down");
                }, registry, CLOCK);

        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(result.getNotifications()).hasSize(3);
        assertThat(result.getStageFailures()).hasSize(3)
                .allSatisfy(f -> {
                    assertThat(f.getStage()).isEqualTo(PipelineStage.NOTIFICATION);
                    assertThat(f.getMessage()).startsWith("Dispatch failed for pattern ")
                            .endsWith(": channel down");
                });
        assertThat(counter(PipelineMetrics.NOTIFICATIONS_DISPATCHED)).isZero();
        assertThat(registry.get(PipelineMetrics.STAGE_FAILURES).tag("stage", "notification").counter().count())
                .isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should skip correlation when disabled")
    void shouldSkipCorrelationWhenDisabled() {
        pipeline.close();
        pipeline = new FailurePatternPipeline(engineConfig,
                PipelineConfig.builder().correlationEnabled(false).parallelism(1).build(),
                null, registry, CLOCK);

        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCorrelation()).isEmpty();
        assertThat(result.getNotifications()).hasSize(3);
    }

    @Test
    @DisplayName("Lowering the notification threshold should not add payloads for quiet floors")
    void shouldRespectNotificationThreshold() {
        pipeline.close();
        pipeline = new FailurePatternPipeline(engineConfig,
                PipelineConfig.builder().notificationMinSeverity(Severity.INFO).build(),
                null, registry, CLOCK);

        PipelineResult result = pipeline.run(building(), window(), EquipmentContext.builder().build());

        assertThat(result.getNotifications())
                .extracting(payload -> payload.getPattern().getFloorNumber())
                .containsExactly(5, 7, 6);
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNullArguments() {
        EquipmentContext context = EquipmentContext.builder().build();

        assertThatThrownBy(() -> pipeline.run(null, window(), context))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> pipeline.run(building(), null, context))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> pipeline.run(building(), window(), null))
                .isInstanceOf(NullPointerException.class);
    }

    // ---- Helpers ----

    private static double noise(int i) {
        return 0.5 * ((i * 7) % 5 - 2);
    }

    private static AnalysisWindow window() {
        return AnalysisWindow.hourly(BASE, BASE.plus(Duration.ofHours(HOURS - 1)));
    }

    private static List<TimeSeriesPoint> building() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int floor = 1; floor <= FLOORS; floor++) {
            int spikeStart = floor == 6 ? 31 : 30;
            boolean spiking = floor >= 5;
            for (int h = 0; h < HOURS; h++) {
                double value = 100.0 + noise(h);
                if (spiking && h >= spikeStart && h < spikeStart + 3) {
                    value += 40.0;
                }
                points.add(TimeSeriesPoint.builder()
                        .sensorId("hvac-floor-" + floor)
                        .equipmentType(EquipmentType.HVAC)
                        .floorNumber(floor)
                        .timestamp(BASE.plus(Duration.ofHours(h)))
                        .value(value)
                        .build());
            }
        }
        return points;
    }

    private static String patternOnFloor(PipelineResult result, int floor) {
        return result.getDetection().getPatterns().stream()
                .filter(p -> p.getFloorNumber() == floor)
                .map(DetectedPattern::getPatternId)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No pattern on floor " + floor));
    }

    private static TemporalCorrelation temporal(CorrelationResult result, String a, String b) {
        return result.getTemporalCorrelations().stream()
                .filter(t -> t.getPatternIdA().equals(a) && t.getPatternIdB().equals(b))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No temporal correlation " + a + " -> " + b));
    }

    private double counter(String name) {
        return registry.get(name).counter().count();
    }
}
