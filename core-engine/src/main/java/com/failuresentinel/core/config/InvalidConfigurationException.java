package com.failuresentinel.core.config;

import com.failuresentinel.core.model.EngineError;

import java.util.Objects;

/**
 * Raised when a configuration object is built with out-of-range values.
 *
 * <p>
 * Thrown at construction time, before any data is processed. The typed
 * {@link EngineError} is available to callers that render failures.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient EngineError error;

    public InvalidConfigurationException(EngineError error) {
        super(Objects.requireNonNull(error, "error must not be null").getMessage());
        this.error = error;
    }

    public InvalidConfigurationException(EngineError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error must not be null").getMessage(), cause);
        this.error = error;
    }

    public EngineError getError() {
        return error;
    }
}
