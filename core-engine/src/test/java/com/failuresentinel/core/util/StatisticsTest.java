package com.failuresentinel.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Statistics}.
 */
class StatisticsTest {

    @Test
    @DisplayName("Median should average the two middle values of an even-length prefix")
    void shouldComputeMedian() {
        double[] values = { 5, 1, 4, 2, 99 };

        assertThat(Statistics.median(values, 5)).isEqualTo(4.0);
        assertThat(Statistics.median(values, 4)).isEqualTo(3.0);
        assertThat(values).containsExactly(5, 1, 4, 2, 99);
    }

    @Test
    @DisplayName("Median of an empty prefix should be rejected")
    void shouldRejectEmptyMedian() {
        assertThatThrownBy(() -> Statistics.median(new double[0], 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Slope should match a perfect line")
    void shouldComputeSlope() {
        assertThat(Statistics.slope(new double[] { 1, 3, 5, 7 })).isCloseTo(2.0, within(1e-12));
        assertThat(Statistics.slope(new double[] { 0, 2, 4 }, new double[] { 1, 2, 3 }))
                .isCloseTo(0.5, within(1e-12));
        assertThat(Statistics.slope(new double[] { 1, 1 }, new double[] { 1, 5 })).isZero();
    }

    @Test
    @DisplayName("Pearson should find a shifted copy at the matching lag")
    void shouldCorrelateAtLag() {
        double[] a = { 0, 0, 5, 9, 5, 0, 0, 0 };
        double[] b = { 0, 0, 0, 5, 9, 5, 0, 0 };

        assertThat(Statistics.pearson(a, b, 1)).isCloseTo(1.0, within(1e-12));
        assertThat(Statistics.pearson(a, b, 0)).isLessThan(0.9);
    }

    @Test
    @DisplayName("Pearson should return 0 without variance")
    void shouldReturnZeroWithoutVariance() {
        assertThat(Statistics.pearson(new double[] { 1, 1, 1 }, new double[] { 1, 2, 3 }, 0)).isZero();
        assertThat(Statistics.pearson(new double[] { 1, 2 }, new double[] { 1, 2 }, 1)).isZero();
    }

    @Test
    @DisplayName("round1 should keep one decimal")
    void shouldRoundToOneDecimal() {
        assertThat(Statistics.round1(93.96)).isEqualTo(94.0);
        assertThat(Statistics.round1(12.34)).isEqualTo(12.3);
    }
}
