package com.failuresentinel.pipeline;

import com.failuresentinel.core.config.EngineConfigLoader;
import com.failuresentinel.core.model.Severity;

import java.util.Locale;
import java.util.Objects;

/**
 * Typed, immutable configuration of the pattern pipeline runner.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so a
 * deployment can tune the runner without touching the engine's YAML file.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} in a deployed process, or the
 * {@link Builder} in tests. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfig {

    public static final String ENV_PARALLELISM = "PIPELINE_PARALLELISM";
    public static final String ENV_NOTIFICATION_MIN_SEVERITY = "NOTIFICATION_MIN_SEVERITY";
    public static final String ENV_CORRELATION_ENABLED = "CORRELATION_ENABLED";

    private final String engineConfigPath;
    private final int parallelism;
    private final Severity notificationMinSeverity;
    private final boolean correlationEnabled;

    private PipelineConfig(Builder b) {
        this.engineConfigPath = b.engineConfigPath;
        this.parallelism = b.parallelism;
        this.notificationMinSeverity = b.notificationMinSeverity;
        this.correlationEnabled = b.correlationEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfig defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link PipelineConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static PipelineConfig fromEnvironment() {
        try {
            return new Builder()
                    .engineConfigPath(env(EngineConfigLoader.ENV_CONFIG_PATH, ""))
                    .parallelism(Integer.parseInt(env(ENV_PARALLELISM, "3")))
                    .notificationMinSeverity(Severity.fromValue(env(ENV_NOTIFICATION_MIN_SEVERITY, "critical")))
                    .correlationEnabled(parseBoolean(ENV_CORRELATION_ENABLED, env(ENV_CORRELATION_ENABLED, "true")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return path of the engine YAML file; blank means the classpath default
     */
    public String getEngineConfigPath() {
        return engineConfigPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Severity getNotificationMinSeverity() {
        return notificationMinSeverity;
    }

    public boolean isCorrelationEnabled() {
        return correlationEnabled;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link PipelineConfig}.
     *
     * <p>
     * {@link #build()} checks that parallelism is at least 1 and that a
     * notification threshold is set.
     * </p>
     */
    public static class Builder {
        private String engineConfigPath = "";
        private int parallelism = 3;
        private Severity notificationMinSeverity = Severity.CRITICAL;
        private boolean correlationEnabled = true;

        public Builder engineConfigPath(String v) {
            this.engineConfigPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder notificationMinSeverity(Severity v) {
            this.notificationMinSeverity = v;
            return this;
        }

        public Builder correlationEnabled(boolean v) {
            this.correlationEnabled = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link PipelineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public PipelineConfig build() {
            Objects.requireNonNull(notificationMinSeverity, "notificationMinSeverity required");
            if (engineConfigPath == null) {
                engineConfigPath = "";
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            return new PipelineConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    static boolean parseBoolean(String name, String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalStateException(
                    "Failed to parse boolean environment variable " + name + ": '" + value + "'");
        };
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "engineConfigPath='" + engineConfigPath + '\'' +
                ", parallelism=" + parallelism +
                ", notificationMinSeverity=" + notificationMinSeverity +
                ", correlationEnabled=" + correlationEnabled +
                '}';
    }
}
