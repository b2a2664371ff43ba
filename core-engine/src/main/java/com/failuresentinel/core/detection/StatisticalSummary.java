package com.failuresentinel.core.detection;

/**
 * Counters describing one detection run.
 *
 * <p>
 * {@code anomaliesDetected} counts anomalous readings inside reported
 * patterns. The confidence buckets split reported patterns into high
 * ({@code >= 80}), medium ({@code >= 60}) and low.
 * {@code pointsOutsideWindow} counts readings before the lookback-narrowed
 * start of the window or after its end; they are never analysed.
 * </p>
 *
 * @since 1.0.0
 */
public final class StatisticalSummary {

    private static final StatisticalSummary EMPTY = builder().build();

    private final int pointsAnalyzed;
    private final int pointsSkipped;
    private final int pointsOutsideWindow;
    private final int sensorsAnalyzed;
    private final int sensorsSkipped;
    private final int anomaliesDetected;
    private final int patternsSuppressed;
    private final int highConfidencePatterns;
    private final int mediumConfidencePatterns;
    private final int lowConfidencePatterns;
    private final long processingTimeMs;

    private StatisticalSummary(Builder builder) {
        this.pointsAnalyzed = builder.pointsAnalyzed;
        this.pointsSkipped = builder.pointsSkipped;
        this.pointsOutsideWindow = builder.pointsOutsideWindow;
        this.sensorsAnalyzed = builder.sensorsAnalyzed;
        this.sensorsSkipped = builder.sensorsSkipped;
        this.anomaliesDetected = builder.anomaliesDetected;
        this.patternsSuppressed = builder.patternsSuppressed;
        this.highConfidencePatterns = builder.highConfidencePatterns;
        this.mediumConfidencePatterns = builder.mediumConfidencePatterns;
        this.lowConfidencePatterns = builder.lowConfidencePatterns;
        this.processingTimeMs = builder.processingTimeMs;
    }

    public static StatisticalSummary empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int pointsAnalyzed;
        private int pointsSkipped;
        private int pointsOutsideWindow;
        private int sensorsAnalyzed;
        private int sensorsSkipped;
        private int anomaliesDetected;
        private int patternsSuppressed;
        private int highConfidencePatterns;
        private int mediumConfidencePatterns;
        private int lowConfidencePatterns;
        private long processingTimeMs;

        public Builder pointsAnalyzed(int pointsAnalyzed) {
            this.pointsAnalyzed = pointsAnalyzed;
            return this;
        }

        public Builder pointsSkipped(int pointsSkipped) {
            this.pointsSkipped = pointsSkipped;
            return this;
        }

        public Builder pointsOutsideWindow(int pointsOutsideWindow) {
            this.pointsOutsideWindow = pointsOutsideWindow;
            return this;
        }

        public Builder sensorsAnalyzed(int sensorsAnalyzed) {
            this.sensorsAnalyzed = sensorsAnalyzed;
            return this;
        }

        public Builder sensorsSkipped(int sensorsSkipped) {
            this.sensorsSkipped = sensorsSkipped;
            return this;
        }

        public Builder anomaliesDetected(int anomaliesDetected) {
            this.anomaliesDetected = anomaliesDetected;
            return this;
        }

        public Builder patternsSuppressed(int patternsSuppressed) {
            this.patternsSuppressed = patternsSuppressed;
            return this;
        }

        /**
         * Count a reported pattern in its confidence bucket.
         */
        public Builder recordConfidence(double confidence) {
            if (confidence >= 80) {
                highConfidencePatterns++;
            } else if (confidence >= 60) {
                mediumConfidencePatterns++;
            } else {
                lowConfidencePatterns++;
            }
            return this;
        }

        public Builder processingTimeMs(long processingTimeMs) {
            this.processingTimeMs = processingTimeMs;
            return this;
        }

        public StatisticalSummary build() {
            return new StatisticalSummary(this);
        }
    }

    public int getPointsAnalyzed() {
        return pointsAnalyzed;
    }

    public int getPointsSkipped() {
        return pointsSkipped;
    }

    public int getPointsOutsideWindow() {
        return pointsOutsideWindow;
    }

    public int getSensorsAnalyzed() {
        return sensorsAnalyzed;
    }

    public int getSensorsSkipped() {
        return sensorsSkipped;
    }

    public int getAnomaliesDetected() {
        return anomaliesDetected;
    }

    /**
     * @return patterns found but dropped for falling below the sensitivity
     *         floor
     */
    public int getPatternsSuppressed() {
        return patternsSuppressed;
    }

    public int getHighConfidencePatterns() {
        return highConfidencePatterns;
    }

    public int getMediumConfidencePatterns() {
        return mediumConfidencePatterns;
    }

    public int getLowConfidencePatterns() {
        return lowConfidencePatterns;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    @Override
    public String toString() {
        return "StatisticalSummary{" +
                "pointsAnalyzed=" + pointsAnalyzed +
                ", pointsSkipped=" + pointsSkipped +
                ", pointsOutsideWindow=" + pointsOutsideWindow +
                ", sensorsAnalyzed=" + sensorsAnalyzed +
                ", sensorsSkipped=" + sensorsSkipped +
                ", anomaliesDetected=" + anomaliesDetected +
                ", confidence=" + highConfidencePatterns + "/" + mediumConfidencePatterns
                + "/" + lowConfidencePatterns +
                ", processingTimeMs=" + processingTimeMs +
                '}';
    }
}
