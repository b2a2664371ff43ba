package com.failuresentinel.core.model;

import java.util.Objects;

/**
 * Typed failure carried by stage results instead of an exception.
 *
 * <p>
 * Callers switch on {@link #getType()} to render a specific message rather
 * than a generic failure.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineError {

    private final ErrorType type;
    private final String message;

    public EngineError(ErrorType type, String message) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    public static EngineError of(ErrorType type, String message) {
        return new EngineError(type, message);
    }

    public ErrorType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngineError that))
            return false;
        return type == that.type && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
