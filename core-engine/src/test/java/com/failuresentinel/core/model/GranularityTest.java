package com.failuresentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Granularity}.
 */
class GranularityTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    @DisplayName("Should bucket by 15-minute slot, hour and weekday")
    void shouldMapBuckets() {
        Instant ts = Instant.parse("2024-03-06T14:45:00Z"); // Wednesday

        assertThat(Granularity.MINUTE.bucketOf(ts, UTC)).isEqualTo(59);
        assertThat(Granularity.HOUR.bucketOf(ts, UTC)).isEqualTo(14);
        assertThat(Granularity.DAY.bucketOf(ts, UTC)).isEqualTo(2);
    }

    @Test
    @DisplayName("Readings of the same local day should share a cycle at hour and minute resolution")
    void shouldUseLocalDayAsCycle() {
        Instant morning = Instant.parse("2024-03-06T00:15:00Z");
        Instant evening = Instant.parse("2024-03-06T23:45:00Z");
        Instant nextDay = Instant.parse("2024-03-07T00:00:00Z");

        assertThat(Granularity.HOUR.cycleOf(morning, UTC)).isEqualTo(Granularity.HOUR.cycleOf(evening, UTC));
        assertThat(Granularity.MINUTE.cycleOf(nextDay, UTC))
                .isEqualTo(Granularity.MINUTE.cycleOf(evening, UTC) + 1);
    }

    @Test
    @DisplayName("Day-of-week cycles should run Monday to Sunday in the configured zone")
    void shouldUseWeekAsCycle() {
        Instant monday = Instant.parse("2024-03-04T00:00:00Z");
        Instant sunday = Instant.parse("2024-03-10T23:00:00Z");
        Instant nextMonday = Instant.parse("2024-03-11T00:00:00Z");

        assertThat(Granularity.DAY.cycleOf(sunday, UTC)).isEqualTo(Granularity.DAY.cycleOf(monday, UTC));
        assertThat(Granularity.DAY.cycleOf(nextMonday, UTC)).isEqualTo(Granularity.DAY.cycleOf(monday, UTC) + 1);
        // 23:00 UTC Sunday is already Monday in Tokyo
        assertThat(Granularity.DAY.cycleOf(sunday, ZoneId.of("Asia/Tokyo")))
                .isEqualTo(Granularity.DAY.cycleOf(nextMonday, UTC));
    }
}
