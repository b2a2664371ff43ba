package com.failuresentinel.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the pattern pipeline.
 * <p>
 * The hosting process decides where the registry reports to (Prometheus,
 * JMX, logging); the pipeline only defines the meters.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code failure_sentinel.points.processed} – readings fed into detection</li>
 *   <li>{@code failure_sentinel.patterns.detected} – patterns reported by detection</li>
 *   <li>{@code failure_sentinel.stage.failures} – failed stages, tagged by {@code stage}</li>
 *   <li>{@code failure_sentinel.notifications.dispatched} – payloads accepted by the dispatcher</li>
 *   <li>{@code failure_sentinel.pipeline.latency} – end-to-end run time</li>
 * </ul>
 */
public class PipelineMetrics {

    static final String POINTS_PROCESSED = "failure_sentinel.points.processed";
    static final String PATTERNS_DETECTED = "failure_sentinel.patterns.detected";
    static final String STAGE_FAILURES = "failure_sentinel.stage.failures";
    static final String NOTIFICATIONS_DISPATCHED = "failure_sentinel.notifications.dispatched";
    static final String PIPELINE_LATENCY = "failure_sentinel.pipeline.latency";

    private final Counter pointsProcessed;
    private final Counter patternsDetected;
    private final Counter notificationsDispatched;
    private final Map<PipelineStage, Counter> stageFailures = new EnumMap<>(PipelineStage.class);
    private final Timer pipelineLatency;

    public PipelineMetrics(MeterRegistry registry) {
        Objects.requireNonNull(registry, "MeterRegistry must not be null");

        this.pointsProcessed = Counter.builder(POINTS_PROCESSED)
                .description("Sensor readings submitted to anomaly detection")
                .register(registry);
        this.patternsDetected = Counter.builder(PATTERNS_DETECTED)
                .description("Failure patterns reported by anomaly detection")
                .register(registry);
        this.notificationsDispatched = Counter.builder(NOTIFICATIONS_DISPATCHED)
                .description("Notification payloads accepted by the dispatcher")
                .register(registry);
        for (PipelineStage stage : PipelineStage.values()) {
            stageFailures.put(stage, Counter.builder(STAGE_FAILURES)
                    .description("Pipeline stages that failed")
                    .tag("stage", stage.getValue())
                    .register(registry));
        }
        this.pipelineLatency = Timer.builder(PIPELINE_LATENCY)
                .description("End-to-end duration of one pipeline run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordPointsProcessed(int count) {
        pointsProcessed.increment(count);
    }

    public void recordPatternsDetected(int count) {
        patternsDetected.increment(count);
    }

    public void incrementStageFailure(PipelineStage stage) {
        stageFailures.get(stage).increment();
    }

    public void incrementNotificationsDispatched() {
        notificationsDispatched.increment();
    }

    public void recordLatency(long nanos) {
        pipelineLatency.record(nanos, TimeUnit.NANOSECONDS);
    }
}
