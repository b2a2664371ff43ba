package com.failuresentinel.core.util;

import java.util.Arrays;

/**
 * Small numeric helpers shared by the analysis stages.
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class, not instantiable
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Median of the first {@code length} values. The array is not modified.
     *
     * @throws IllegalArgumentException if {@code length} is not positive
     */
    public static double median(double[] values, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0, got: " + length);
        }
        double[] sorted = Arrays.copyOf(values, length);
        Arrays.sort(sorted);
        int mid = length / 2;
        return length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Least-squares slope of {@code values} against their index.
     *
     * @return slope per index step, 0 for fewer than two values
     */
    public static double slope(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0.0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            num += dx * (values[i] - meanY);
            den += dx * dx;
        }
        return num / den;
    }

    /**
     * Least-squares slope of {@code y} against {@code x}.
     *
     * @return slope, 0 when {@code x} has no spread
     */
    public static double slope(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return 0.0;
        }
        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            num += dx * (y[i] - meanY);
            den += dx * dx;
        }
        return den == 0 ? 0.0 : num / den;
    }

    /**
     * Pearson correlation of {@code a[i]} with {@code b[i + lag]} over the
     * indices where both are defined.
     *
     * @return correlation clamped to {@code [-1, 1]}, or 0 when either side
     *         has no variance or fewer than two pairs overlap
     */
    public static double pearson(double[] a, double[] b, int lag) {
        int from = Math.max(0, -lag);
        int to = Math.min(a.length, b.length - lag);
        int n = to - from;
        if (n < 2) {
            return 0.0;
        }
        double sumA = 0;
        double sumB = 0;
        for (int i = from; i < to; i++) {
            sumA += a[i];
            sumB += b[i + lag];
        }
        double meanA = sumA / n;
        double meanB = sumB / n;
        double cov = 0;
        double varA = 0;
        double varB = 0;
        for (int i = from; i < to; i++) {
            double da = a[i] - meanA;
            double db = b[i + lag] - meanB;
            cov += da * db;
            varA += da * da;
            varB += db * db;
        }
        if (varA <= 0 || varB <= 0) {
            return 0.0;
        }
        double r = cov / Math.sqrt(varA * varB);
        return clamp(r, -1.0, 1.0);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Round to one decimal place.
     */
    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
