package com.failuresentinel.pipeline;

import com.failuresentinel.core.model.EngineError;
import com.failuresentinel.core.model.ErrorType;

import java.util.Objects;

/**
 * One stage of a pipeline run that did not complete.
 *
 * @since 1.0.0
 */
public final class StageFailure {

    private final PipelineStage stage;
    private final ErrorType errorType;
    private final String message;

    public StageFailure(PipelineStage stage, ErrorType errorType, String message) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    static StageFailure of(PipelineStage stage, EngineError error) {
        return new StageFailure(stage, error.getType(), error.getMessage());
    }

    static StageFailure of(PipelineStage stage, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StageFailure(stage, ErrorType.ANALYSIS_FAILED, stage.getValue() + " failed: " + detail);
    }

    public PipelineStage getStage() {
        return stage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StageFailure that))
            return false;
        return stage == that.stage && errorType == that.errorType && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, errorType, message);
    }

    @Override
    public String toString() {
        return "StageFailure{" + stage + ", " + errorType + ": " + message + '}';
    }
}
