package com.failuresentinel.core.model;

/**
 * Category of a structured engine failure.
 *
 * @since 1.0.0
 */
public enum ErrorType {

    /** Configuration values out of range; raised before any data is processed. */
    INVALID_CONFIGURATION,

    /** No input points were supplied. */
    EMPTY_DATASET,

    /** Fewer points than the configured minimum remained after filtering. */
    INSUFFICIENT_DATA,

    /** Malformed patterns were passed to the correlation analyzer. */
    CORRELATION_INPUT_ERROR,

    /** The caller cancelled the run. */
    CANCELLED,

    /** Unexpected failure inside an analysis stage. */
    ANALYSIS_FAILED
}
