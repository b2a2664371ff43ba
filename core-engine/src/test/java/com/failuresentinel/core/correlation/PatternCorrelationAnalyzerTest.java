package com.failuresentinel.core.correlation;

import com.failuresentinel.core.config.CorrelationConfig;
import com.failuresentinel.core.model.DataPoint;
import com.failuresentinel.core.model.DetectedPattern;
import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.ErrorType;
import com.failuresentinel.core.model.Severity;
import com.failuresentinel.core.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PatternCorrelationAnalyzer}.
 */
class PatternCorrelationAnalyzerTest {

    private static final Instant BASE = Instant.parse("2024-06-10T00:00:00Z");

    private PatternCorrelationAnalyzer analyzer;
    private DetectedPattern floor5;
    private DetectedPattern floor6;
    private DetectedPattern distant;

    @BeforeEach
    void setUp() {
        analyzer = new PatternCorrelationAnalyzer();
        floor5 = pattern("p-floor5", 5, 10, 5.0, 9.0, 5.0);
        floor6 = pattern("p-floor6", 6, 11, 5.0, 9.0, 5.0);
        distant = pattern("p-distant", 2, 40, 6.0, 7.0);
    }

    @Test
    @DisplayName("Matrix should be symmetric with a unit diagonal and null for distant pairs")
    void shouldBuildSymmetricMatrix() {
        CorrelationResult result = analyzer.analyzeCorrelations(List.of(floor5, floor6, distant));

        assertThat(result.isSuccess()).isTrue();
        CorrelationMatrix matrix = result.getCorrelationMatrix();
        assertThat(matrix.getPatternIds()).containsExactly("p-floor5", "p-floor6", "p-distant");
        for (int i = 0; i < matrix.size(); i++) {
            assertThat(matrix.get(i, i)).contains(1.0);
            for (int j = 0; j < matrix.size(); j++) {
                assertThat(matrix.get(i, j)).isEqualTo(matrix.get(j, i));
                matrix.get(i, j).ifPresent(r -> assertThat(r).isBetween(-1.0, 1.0));
            }
        }
        assertThat(matrix.get("p-floor5", "p-distant")).isEmpty();
        assertThat(matrix.get("p-floor5", "p-floor6").orElseThrow()).isCloseTo(0.622, within(0.01));
    }

    @Test
    @DisplayName("Best lag should reveal that the second pattern follows the first by one step")
    void shouldFindLaggedCorrelation() {
        CorrelationResult result = analyzer.analyzeCorrelations(List.of(floor5, floor6));

        assertThat(result.getTemporalCorrelations()).hasSize(1);
        TemporalCorrelation temporal = result.getTemporalCorrelations().get(0);
        assertThat(temporal.getPatternIdA()).isEqualTo("p-floor5");
        assertThat(temporal.getPatternIdB()).isEqualTo("p-floor6");
        assertThat(temporal.getLag()).isEqualTo(1);
        assertThat(temporal.getLagDuration()).isEqualTo(Duration.ofHours(1));
        assertThat(temporal.getCorrelation()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Floor summary should average lag-0 correlation per floor pair")
    void shouldSummariseFloors() {
        CorrelationResult result = analyzer.analyzeCorrelations(List.of(floor6, floor5));

        assertThat(result.getFloorCorrelations()).hasSize(1);
        FloorCorrelation floors = result.getFloorCorrelations().get(0);
        assertThat(floors.getFloorA()).isEqualTo(5);
        assertThat(floors.getFloorB()).isEqualTo(6);
        assertThat(floors.getPairCount()).isEqualTo(1);
        assertThat(floors.getMeanCorrelation()).isCloseTo(0.622, within(0.01));
    }

    @Test
    @DisplayName("Correlations below the minimum should not be reported")
    void shouldFilterWeakCorrelations() {
        CorrelationConfig config = new CorrelationConfig();
        config.setMaxLagSteps(0);
        config.setMinCorrelation(0.7);

        CorrelationResult result = new PatternCorrelationAnalyzer(config)
                .analyzeCorrelations(List.of(floor5, floor6));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTemporalCorrelations()).isEmpty();
        assertThat(result.getCorrelationMatrix().get(0, 1)).isPresent();
    }

    @Test
    @DisplayName("Fewer than two patterns should give a trivial matrix")
    void shouldHandleTrivialInput() {
        CorrelationResult none = analyzer.analyzeCorrelations(List.of());
        CorrelationResult single = analyzer.analyzeCorrelations(List.of(floor5));

        assertThat(none.isSuccess()).isTrue();
        assertThat(none.getCorrelationMatrix().size()).isZero();
        assertThat(single.getCorrelationMatrix().get(0, 0)).contains(1.0);
        assertThat(single.getTemporalCorrelations()).isEmpty();
    }

    @Test
    @DisplayName("Malformed input should yield CORRELATION_INPUT_ERROR")
    void shouldRejectMalformedInput() {
        List<DetectedPattern> withNull = new ArrayList<>(Arrays.asList(floor5, null));
        DetectedPattern empty = DetectedPattern.builder()
                .patternId("p-empty")
                .equipmentType(EquipmentType.HVAC)
                .severity(Severity.INFO)
                .detectedAt(BASE)
                .build();

        assertThat(analyzer.analyzeCorrelations(null).getError())
                .map(EngineError::getMessage).contains("Pattern list must not be null");
        assertThat(analyzer.analyzeCorrelations(withNull).getError())
                .map(EngineError::getMessage).contains("Pattern at index 1 is null");
        CorrelationResult result = analyzer.analyzeCorrelations(List.of(floor5, empty));
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).map(EngineError::getType).contains(ErrorType.CORRELATION_INPUT_ERROR);
        assertThat(result.getError()).map(EngineError::getMessage).contains("Pattern p-empty has no data points");
    }

    @Test
    @DisplayName("Should return CANCELLED when cancellation was requested")
    void shouldHonourCancellation() {
        CancellationToken token = CancellationToken.create();
        token.cancel();

        CorrelationResult result = analyzer.analyzeCorrelations(List.of(floor5, floor6), token);

        assertThat(result.getError()).map(EngineError::getType).contains(ErrorType.CANCELLED);
    }

    @Test
    @DisplayName("Grid step should widen when the span exceeds the slot budget")
    void shouldWidenGridStep() {
        CorrelationConfig config = new CorrelationConfig();
        config.setMaxGridSlots(100);
        PatternCorrelationAnalyzer bounded = new PatternCorrelationAnalyzer(config);
        DetectedPattern early = patternAtMinutes("p-early", 0, 1);
        DetectedPattern late = patternAtMinutes("p-late", 1000, 1001);

        long step = bounded.gridStepMillis(List.of(early, late));

        // 100 slots less 2 * 6 lag slots less one
        assertThat(step).isEqualTo(Duration.ofMinutes(1001).toMillis() / 87 + 1);
        assertThat(analyzer.gridStepMillis(List.of(early, late))).isEqualTo(Duration.ofMinutes(1).toMillis());
    }

    @Test
    @DisplayName("Matrix lookups should reject unknown ids")
    void shouldRejectUnknownId() {
        CorrelationMatrix matrix = analyzer.analyzeCorrelations(List.of(floor5)).getCorrelationMatrix();

        assertThatThrownBy(() -> matrix.get("p-floor5", "nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectedPattern pattern(String id, int floor, int startHour, double... scores) {
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            points.add(new DataPoint(BASE.plus(Duration.ofHours(startHour + i)), 100 + scores[i], 100, scores[i]));
        }
        return DetectedPattern.builder()
                .patternId(id)
                .sensorId("sensor-" + id)
                .equipmentType(EquipmentType.HVAC)
                .floorNumber(floor)
                .confidenceScore(95)
                .severity(Severity.CRITICAL)
                .dataPoints(points)
                .detectedAt(BASE)
                .build();
    }

    private DetectedPattern patternAtMinutes(String id, int... minutes) {
        List<DataPoint> points = new ArrayList<>();
        for (int minute : minutes) {
            points.add(new DataPoint(BASE.plus(Duration.ofMinutes(minute)), 50, 40, 4.0));
        }
        return DetectedPattern.builder()
                .patternId(id)
                .equipmentType(EquipmentType.POWER)
                .confidenceScore(80)
                .severity(Severity.WARNING)
                .dataPoints(points)
                .detectedAt(BASE)
                .build();
    }
}
