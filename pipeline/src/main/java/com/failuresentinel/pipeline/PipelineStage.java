package com.failuresentinel.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stages of one pipeline run, in execution order.
 *
 * @since 1.0.0
 */
public enum PipelineStage {

    DETECTION,
    CLASSIFICATION,
    CORRELATION,
    RECOMMENDATION,
    NOTIFICATION;

    /**
     * @return lowercase name, used as the metric tag value
     */
    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
