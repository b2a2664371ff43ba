package com.failuresentinel.core.detection;

import com.failuresentinel.core.util.Statistics;

import java.util.Arrays;

/**
 * Additive seasonal component estimated from per-bucket medians.
 *
 * <p>
 * The component of a bucket is its median minus the median of all bucket
 * medians, so adjusting a series keeps its overall level. Medians keep a
 * single extreme reading from shifting its own bucket. The profile is only
 * applied when every populated bucket is covered by at least
 * {@value #MIN_CYCLES_PER_BUCKET} distinct cycles (days, or weeks for
 * day-of-week buckets); otherwise every adjustment is 0. Counting cycles
 * rather than samples keeps readings finer than the bucket, such as four
 * 15-minute readings in one hour bucket, from defining their own baseline.
 * </p>
 */
final class SeasonalProfile {

    static final int MIN_CYCLES_PER_BUCKET = 3;

    private static final SeasonalProfile NONE = new SeasonalProfile(null);

    private final double[] adjustments;

    private SeasonalProfile(double[] adjustments) {
        this.adjustments = adjustments;
    }

    /**
     * @param values      series values
     * @param buckets     bucket index of every value
     * @param cycles      cycle index of every value, non-decreasing
     * @param bucketCount number of buckets of the granularity
     * @return fitted profile, or a profile that adjusts nothing when some
     *         bucket is covered by too few cycles
     */
    static SeasonalProfile fit(double[] values, int[] buckets, long[] cycles, int bucketCount) {
        int[] counts = new int[bucketCount];
        int[] cycleCounts = new int[bucketCount];
        long[] lastCycle = new long[bucketCount];
        for (int i = 0; i < buckets.length; i++) {
            int bucket = buckets[i];
            if (counts[bucket] == 0 || cycles[i] != lastCycle[bucket]) {
                cycleCounts[bucket]++;
                lastCycle[bucket] = cycles[i];
            }
            counts[bucket]++;
        }
        int populated = 0;
        for (int b = 0; b < bucketCount; b++) {
            if (counts[b] > 0 && cycleCounts[b] < MIN_CYCLES_PER_BUCKET) {
                return NONE;
            }
            if (counts[b] > 0) {
                populated++;
            }
        }
        if (populated < 2) {
            return NONE;
        }

        // counting sort of values into contiguous bucket slices
        int[] offsets = new int[bucketCount + 1];
        for (int b = 0; b < bucketCount; b++) {
            offsets[b + 1] = offsets[b] + counts[b];
        }
        int[] cursor = Arrays.copyOf(offsets, bucketCount);
        double[] grouped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            grouped[cursor[buckets[i]]++] = values[i];
        }

        double[] medians = new double[bucketCount];
        double[] populatedMedians = new double[populated];
        int p = 0;
        for (int b = 0; b < bucketCount; b++) {
            if (counts[b] > 0) {
                double[] slice = Arrays.copyOfRange(grouped, offsets[b], offsets[b + 1]);
                medians[b] = Statistics.median(slice, slice.length);
                populatedMedians[p++] = medians[b];
            }
        }
        double center = Statistics.median(populatedMedians, populated);

        double[] adjustments = new double[bucketCount];
        for (int b = 0; b < bucketCount; b++) {
            adjustments[b] = counts[b] > 0 ? medians[b] - center : 0.0;
        }
        return new SeasonalProfile(adjustments);
    }

    boolean isApplied() {
        return adjustments != null;
    }

    double adjustment(int bucket) {
        return adjustments == null ? 0.0 : adjustments[bucket];
    }

    /**
     * @return {@code values} minus the component of each value's bucket
     */
    double[] remove(double[] values, int[] buckets) {
        double[] adjusted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            adjusted[i] = values[i] - adjustment(buckets[i]);
        }
        return adjusted;
    }
}
