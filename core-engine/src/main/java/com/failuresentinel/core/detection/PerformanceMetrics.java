package com.failuresentinel.core.detection;

/**
 * Throughput figures of one detection run.
 *
 * @since 1.0.0
 */
public final class PerformanceMetrics {

    private static final PerformanceMetrics ZERO = new PerformanceMetrics(0, 0, 0);

    private final double throughputPointsPerSecond;
    private final double pointsPerMillisecond;
    private final double estimatedMemoryMb;

    public PerformanceMetrics(double throughputPointsPerSecond, double pointsPerMillisecond,
            double estimatedMemoryMb) {
        this.throughputPointsPerSecond = throughputPointsPerSecond;
        this.pointsPerMillisecond = pointsPerMillisecond;
        this.estimatedMemoryMb = estimatedMemoryMb;
    }

    public static PerformanceMetrics zero() {
        return ZERO;
    }

    /**
     * Derive metrics from a point count and elapsed wall time. Memory is
     * estimated at 100 bytes per point plus a fixed 50 KB overhead.
     *
     * @param points       number of points processed
     * @param elapsedNanos elapsed time in nanoseconds
     */
    public static PerformanceMetrics of(int points, long elapsedNanos) {
        double nanos = Math.max(1L, elapsedNanos);
        return new PerformanceMetrics(
                points * 1_000_000_000.0 / nanos,
                points * 1_000_000.0 / nanos,
                (points * 100.0 + 50_000.0) / (1024.0 * 1024.0));
    }

    public double getThroughputPointsPerSecond() {
        return throughputPointsPerSecond;
    }

    public double getPointsPerMillisecond() {
        return pointsPerMillisecond;
    }

    public double getEstimatedMemoryMb() {
        return estimatedMemoryMb;
    }

    @Override
    public String toString() {
        return String.format("PerformanceMetrics{throughput=%.0f pts/s, efficiency=%.2f pts/ms, memory=%.3f MB}",
                throughputPointsPerSecond, pointsPerMillisecond, estimatedMemoryMb);
    }
}
