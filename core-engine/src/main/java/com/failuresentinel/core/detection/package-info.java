/**
 * Anomaly detection over sensor time series.
 *
 * <p>
 * {@link com.failuresentinel.core.detection.DetectorFactory} creates an
 * {@link com.failuresentinel.core.detection.AnomalyDetector} for the
 * configured algorithm. Both implementations share the baseline, grouping and
 * confidence logic of
 * {@link com.failuresentinel.core.detection.AbstractBaselineDetector} and
 * differ only in how the residual series is derived.
 * </p>
 *
 * @since 1.0.0
 */
package com.failuresentinel.core.detection;
