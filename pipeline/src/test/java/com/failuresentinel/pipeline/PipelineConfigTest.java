package com.failuresentinel.pipeline;

import com.failuresentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfig}.
 */
class PipelineConfigTest {

    @Test
    @DisplayName("Should provide defaults")
    void shouldProvideDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertThat(config.getEngineConfigPath()).isEmpty();
        assertThat(config.getParallelism()).isEqualTo(3);
        assertThat(config.getNotificationMinSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(config.isCorrelationEnabled()).isTrue();
    }

    @Test
    @DisplayName("Builder should apply every setting")
    void shouldApplyBuilderSettings() {
        PipelineConfig config = PipelineConfig.builder()
                .engineConfigPath("/etc/failure-sentinel/engine.yml")
                .parallelism(1)
                .notificationMinSeverity(Severity.WARNING)
                .correlationEnabled(false)
                .build();

        assertThat(config.getEngineConfigPath()).isEqualTo("/etc/failure-sentinel/engine.yml");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getNotificationMinSeverity()).isEqualTo(Severity.WARNING);
        assertThat(config.isCorrelationEnabled()).isFalse();
        assertThat(config.toString()).contains("parallelism=1", "correlationEnabled=false");
    }

    @Test
    @DisplayName("Should reject invalid parallelism and a missing severity")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> PipelineConfig.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("parallelism must be >= 1, got: 0");
        assertThatThrownBy(() -> PipelineConfig.builder().notificationMinSeverity(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should parse boolean flags leniently")
    void shouldParseBooleans() {
        assertThat(PipelineConfig.parseBoolean("FLAG", "true")).isTrue();
        assertThat(PipelineConfig.parseBoolean("FLAG", " YES ")).isTrue();
        assertThat(PipelineConfig.parseBoolean("FLAG", "1")).isTrue();
        assertThat(PipelineConfig.parseBoolean("FLAG", "False")).isFalse();
        assertThat(PipelineConfig.parseBoolean("FLAG", "no")).isFalse();
        assertThat(PipelineConfig.parseBoolean("FLAG", "0")).isFalse();

        assertThatThrownBy(() -> PipelineConfig.parseBoolean("CORRELATION_ENABLED", "maybe"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CORRELATION_ENABLED")
                .hasMessageContaining("maybe");
    }
}
