package com.failuresentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Resolution of the seasonal comparison baseline.
 *
 * <ul>
 * <li>{@code MINUTE} buckets by 15-minute slot of the day (96 buckets)</li>
 * <li>{@code HOUR} buckets by hour of day (24 buckets)</li>
 * <li>{@code DAY} buckets by day of week (7 buckets)</li>
 * </ul>
 *
 * <p>
 * A cycle is one full pass over the buckets: a local day for {@code MINUTE}
 * and {@code HOUR}, a Monday-to-Sunday week for {@code DAY}.
 * </p>
 *
 * @since 1.0.0
 */
public enum Granularity {

    MINUTE(96),
    HOUR(24),
    DAY(7);

    private final int bucketCount;

    Granularity(int bucketCount) {
        this.bucketCount = bucketCount;
    }

    /**
     * @return number of distinct seasonal buckets at this resolution
     */
    public int getBucketCount() {
        return bucketCount;
    }

    /**
     * Map an instant to its seasonal bucket.
     *
     * @param timestamp the reading time
     * @param zone      zone in which the daily cycle is observed
     * @return bucket index in {@code [0, bucketCount)}
     */
    public int bucketOf(Instant timestamp, ZoneId zone) {
        ZonedDateTime local = timestamp.atZone(zone);
        return switch (this) {
            case MINUTE -> local.getHour() * 4 + local.getMinute() / 15;
            case HOUR -> local.getHour();
            case DAY -> local.getDayOfWeek().getValue() - 1;
        };
    }

    /**
     * Map an instant to the cycle it belongs to. Cycle indices grow with time,
     * so two readings share a cycle only if they fall in the same local day
     * (or week, for {@code DAY}).
     *
     * @param timestamp the reading time
     * @param zone      zone in which the cycle is observed
     * @return cycle index
     */
    public long cycleOf(Instant timestamp, ZoneId zone) {
        long epochDay = timestamp.atZone(zone).toLocalDate().toEpochDay();
        return switch (this) {
            case MINUTE, HOUR -> epochDay;
            // 1970-01-01 was a Thursday
            case DAY -> Math.floorDiv(epochDay + 3, 7);
        };
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
