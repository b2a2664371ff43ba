package com.failuresentinel.pipeline;

import com.failuresentinel.core.classification.ClassificationResult;
import com.failuresentinel.core.classification.PatternClassifier;
import com.failuresentinel.core.config.EngineConfig;
import com.failuresentinel.core.config.EngineConfigLoader;
import com.failuresentinel.core.correlation.CorrelationResult;
import com.failuresentinel.core.correlation.PatternCorrelationAnalyzer;
import com.failuresentinel.core.detection.AnomalyDetector;
import com.failuresentinel.core.detection.DetectionResult;
import com.failuresentinel.core.detection.DetectorFactory;
import com.failuresentinel.core.model.AnalysisWindow;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.EquipmentContext;
import com.failuresentinel.core.model.ErrorType;
import com.failuresentinel.core.model.PatternWithRecommendations;
import com.failuresentinel.core.model.Recommendation;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.model.TimeSeriesPoint;
import com.failuresentinel.core.recommendation.RecommendationEngine;
import com.failuresentinel.core.util.CancellationToken;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * End-to-end runner of the failure pattern engine.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   sensor readings
 *     → anomaly detection (z-score or seasonal decomposition)
 *     → classification ┐
 *     → correlation    ├ concurrently, on a bounded executor
 *     → recommendation ┘
 *     → notification payloads for severe patterns
 * </pre>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A failed detection ends the run with the detection error. After detection,
 * every stage is independent: a stage that reports an error or throws is
 * recorded as a {@link StageFailure} and the others still deliver their
 * output. Dispatcher exceptions are logged and recorded, never rethrown.
 * </p>
 *
 * <p>
 * Cancellation is checked again once detection is done and once the
 * concurrent stages have finished. A cancelled run returns only a
 * {@code CANCELLED} failure: no patterns, stage output or notifications.
 * </p>
 *
 * <p>
 * Instances are thread-safe and own a worker pool; {@link #close()} them when
 * done.
 * </p>
 *
 * @since 1.0.0
 */
public class FailurePatternPipeline implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FailurePatternPipeline.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final PipelineConfig config;
    private final AnomalyDetector detector;
    private final PatternClassifier classifier;
    private final PatternCorrelationAnalyzer correlationAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final NotificationDispatcher dispatcher;
    private final NotificationPayloadSerializer serializer = new NotificationPayloadSerializer();
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final ExecutorService executor;

    public FailurePatternPipeline(EngineConfig engineConfig, PipelineConfig config,
            NotificationDispatcher dispatcher, MeterRegistry registry) {
        this(engineConfig, config, dispatcher, registry, Clock.systemUTC());
    }

    /**
     * @param engineConfig validated engine configuration
     * @param config       runner configuration
     * @param dispatcher   notification channel, or {@code null} to only
     *                     collect payloads
     * @param registry     meter registry the pipeline metrics register with
     * @param clock        clock used for detection and payload timestamps
     */
    public FailurePatternPipeline(EngineConfig engineConfig, PipelineConfig config,
            NotificationDispatcher dispatcher, MeterRegistry registry, Clock clock) {
        this(config,
                DetectorFactory.create(Objects.requireNonNull(engineConfig, "EngineConfig must not be null")
                        .detectorConfig(), clock),
                new PatternClassifier(engineConfig.getClassifier()),
                new PatternCorrelationAnalyzer(engineConfig.getCorrelation()),
                new RecommendationEngine(engineConfig.getRecommendation(), clock),
                dispatcher, new PipelineMetrics(registry), clock);
    }

    FailurePatternPipeline(PipelineConfig config, AnomalyDetector detector, PatternClassifier classifier,
            PatternCorrelationAnalyzer correlationAnalyzer, RecommendationEngine recommendationEngine,
            NotificationDispatcher dispatcher, PipelineMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "PipelineConfig must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.correlationAnalyzer = Objects.requireNonNull(correlationAnalyzer, "correlationAnalyzer must not be null");
        this.recommendationEngine = Objects.requireNonNull(recommendationEngine,
                "recommendationEngine must not be null");
        this.dispatcher = dispatcher;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Executors.newFixedThreadPool(config.getParallelism(), new StageThreadFactory());
    }

    /**
     * Build a pipeline from {@link PipelineConfig#fromEnvironment()} and the
     * engine YAML it points at.
     */
    public static FailurePatternPipeline fromEnvironment(NotificationDispatcher dispatcher,
            MeterRegistry registry) {
        PipelineConfig config = PipelineConfig.fromEnvironment();
        LOG.info("Starting failure pattern pipeline with config: {}", config);
        EngineConfig engineConfig = EngineConfigLoader.load(config.getEngineConfigPath());
        return new FailurePatternPipeline(engineConfig, config, dispatcher, registry);
    }

    public PipelineResult run(List<TimeSeriesPoint> points, AnalysisWindow window, EquipmentContext context) {
        return run(points, window, context, CancellationToken.none());
    }

    /**
     * Run every stage over one batch of readings.
     *
     * @param points       sensor readings; must not be {@code null}
     * @param window       analysis window; must not be {@code null}
     * @param context      equipment context for recommendations; must not be
     *                     {@code null}
     * @param cancellation cooperative cancellation token
     * @return the combined outcome; never {@code null}
     */
    public PipelineResult run(List<TimeSeriesPoint> points, AnalysisWindow window, EquipmentContext context,
            CancellationToken cancellation) {
        Objects.requireNonNull(points, "points must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(cancellation, "cancellation token must not be null");
        long started = System.nanoTime();
        List<StageFailure> failures = new ArrayList<>();

        // 1. Detect
        metrics.recordPointsProcessed(points.size());
        DetectionResult detection = detect(points, window, cancellation);
        if (!detection.isSuccess()) {
            EngineError error = detection.getError()
                    .orElse(EngineError.of(ErrorType.ANALYSIS_FAILED, "Anomaly detection failed"));
            record(failures, StageFailure.of(PipelineStage.DETECTION, error));
            LOG.warn("Detection failed, skipping downstream stages: {}", error.getMessage());
            return finish(detection, List.of(), null, List.of(), List.of(), failures, started);
        }
        if (cancellation.isCancellationRequested()) {
            return cancelled(PipelineStage.CLASSIFICATION, failures, started);
        }
        List<DetectedPattern> patterns = detection.getPatterns();
        metrics.recordPatternsDetected(patterns.size());

        // 2. Classify, correlate and recommend concurrently
        Future<List<ClassificationResult>> classifying = executor.submit(
                () -> classifier.classifyPatterns(patterns));
        Future<CorrelationResult> correlating = config.isCorrelationEnabled()
                ? executor.submit(() -> correlationAnalyzer.analyzeCorrelations(patterns, cancellation))
                : null;
        Future<List<PatternWithRecommendations>> recommending = executor.submit(
                () -> recommendationEngine.generateRecommendations(patterns, context));

        List<ClassificationResult> classifications = await(classifying, PipelineStage.CLASSIFICATION, failures);
        CorrelationResult correlation = null;
        if (correlating != null) {
            correlation = await(correlating, PipelineStage.CORRELATION, failures);
            if (correlation != null && !correlation.isSuccess()) {
                correlation.getError().ifPresent(
                        error -> record(failures, StageFailure.of(PipelineStage.CORRELATION, error)));
            }
        }
        List<PatternWithRecommendations> recommendations = await(recommending,
                PipelineStage.RECOMMENDATION, failures);
        if (cancellation.isCancellationRequested()) {
            return cancelled(PipelineStage.NOTIFICATION, failures, started);
        }

        // 3. Notify
        List<NotificationPayload> notifications = notify(patterns,
                classifications != null ? classifications : List.of(),
                recommendations != null ? recommendations : List.of(), failures);

        return finish(detection,
                classifications != null ? classifications : List.of(),
                correlation,
                recommendations != null ? recommendations : List.of(),
                notifications, failures, started);
    }

    // ---------------------------------------------------------------
    // Stages
    // ---------------------------------------------------------------

    private DetectionResult detect(List<TimeSeriesPoint> points, AnalysisWindow window,
            CancellationToken cancellation) {
        try {
            return detector.detectAnomalies(points, window, cancellation);
        } catch (RuntimeException e) {
            LOG.error("Anomaly detection threw for {} point(s)", points.size(), e);
            return DetectionResult.failure(EngineError.of(ErrorType.ANALYSIS_FAILED,
                    "Anomaly detection failed: " + e.getMessage()));
        }
    }

    private <T> T await(Future<T> future, PipelineStage stage, List<StageFailure> failures) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Pipeline stage {} failed: {}", stage.getValue(), cause.getMessage(), cause);
            record(failures, StageFailure.of(stage, cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted while waiting for pipeline stage {}", stage.getValue());
            record(failures, new StageFailure(stage, ErrorType.CANCELLED,
                    stage.getValue() + " interrupted"));
        }
        return null;
    }

    private List<NotificationPayload> notify(List<DetectedPattern> patterns,
            List<ClassificationResult> classifications, List<PatternWithRecommendations> recommendations,
            List<StageFailure> failures) {
        Map<String, ClassificationResult> classificationById = new HashMap<>();
        for (ClassificationResult classification : classifications) {
            classificationById.put(classification.getPatternId(), classification);
        }
        Map<String, List<Recommendation>> recommendationsById = new HashMap<>();
        for (PatternWithRecommendations entry : recommendations) {
            recommendationsById.put(entry.getPattern().getPatternId(), entry.getRecommendations());
        }

        Severity threshold = config.getNotificationMinSeverity();
        List<NotificationPayload> payloads = new ArrayList<>();
        for (DetectedPattern pattern : patterns) {
            ClassificationResult classification = classificationById.get(pattern.getPatternId());
            Severity severity = classification != null ? classification.getSeverity() : pattern.getSeverity();
            if (!severity.isAtLeast(threshold)) {
                continue;
            }
            NotificationPayload payload = new NotificationPayload(pattern, classification,
                    recommendationsById.get(pattern.getPatternId()), clock.instant());
            payloads.add(payload);
            dispatch(payload, failures);
        }
        return payloads;
    }

    private void dispatch(NotificationPayload payload, List<StageFailure> failures) {
        if (dispatcher == null) {
            return;
        }
        try {
            dispatcher.dispatch(payload, serializer.serialize(payload));
            metrics.incrementNotificationsDispatched();
        } catch (Exception e) {
            LOG.error("Failed to dispatch notification for pattern {}: {}",
                    payload.getPattern().getPatternId(), e.getMessage(), e);
            record(failures, new StageFailure(PipelineStage.NOTIFICATION, ErrorType.ANALYSIS_FAILED,
                    "Dispatch failed for pattern " + payload.getPattern().getPatternId() + ": " + e.getMessage()));
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private void record(List<StageFailure> failures, StageFailure failure) {
        failures.add(failure);
        metrics.incrementStageFailure(failure.getStage());
    }

    /**
     * @param stage the stage the run was about to enter
     */
    private PipelineResult cancelled(PipelineStage stage, List<StageFailure> failures, long started) {
        EngineError error = EngineError.of(ErrorType.CANCELLED, "Pipeline run cancelled");
        record(failures, StageFailure.of(stage, error));
        LOG.info("Pipeline run cancelled before stage {}, discarding stage output", stage.getValue());
        return finish(DetectionResult.failure(error), List.of(), null, List.of(), List.of(), failures, started);
    }

    private PipelineResult finish(DetectionResult detection, List<ClassificationResult> classifications,
            CorrelationResult correlation, List<PatternWithRecommendations> recommendations,
            List<NotificationPayload> notifications, List<StageFailure> failures, long started) {
        long elapsedNanos = System.nanoTime() - started;
        metrics.recordLatency(elapsedNanos);
        PipelineResult result = new PipelineResult(detection, classifications, correlation, recommendations,
                notifications, failures, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        LOG.info("Pipeline run finished: {}", result);
        return result;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Pipeline workers did not stop within {} s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class StageThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "failure-sentinel-stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
