package com.failuresentinel.core.correlation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Symmetric matrix of pairwise pattern correlations, indexed in the order of
 * {@link #getPatternIds()}.
 *
 * <p>
 * The diagonal is exactly {@code 1.0}. An absent entry means the two patterns
 * do not overlap in time and were not compared, which is distinct from a
 * correlation of {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationMatrix {

    private static final CorrelationMatrix EMPTY = new CorrelationMatrix(List.of(), new Double[0][0]);

    private final List<String> patternIds;
    private final Double[][] values;

    CorrelationMatrix(List<String> patternIds, Double[][] values) {
        this.patternIds = List.copyOf(patternIds);
        this.values = values;
    }

    public static CorrelationMatrix empty() {
        return EMPTY;
    }

    public List<String> getPatternIds() {
        return patternIds;
    }

    public int size() {
        return patternIds.size();
    }

    /**
     * @return correlation of the patterns at rows {@code i} and {@code j}, or
     *         empty when they were not comparable
     * @throws IndexOutOfBoundsException if an index is out of range
     */
    public Optional<Double> get(int i, int j) {
        Objects.checkIndex(i, values.length);
        Objects.checkIndex(j, values.length);
        return Optional.ofNullable(values[i][j]);
    }

    /**
     * @throws IllegalArgumentException if either id is not in the matrix
     */
    public Optional<Double> get(String patternIdA, String patternIdB) {
        return get(indexOf(patternIdA), indexOf(patternIdB));
    }

    /**
     * @return a copy of the raw entries; {@code null} marks incomparable pairs
     */
    public Double[][] toArray() {
        Double[][] copy = new Double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    private int indexOf(String patternId) {
        int index = patternIds.indexOf(patternId);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown pattern id: " + patternId);
        }
        return index;
    }

    @Override
    public String toString() {
        return "CorrelationMatrix{size=" + size() + '}';
    }
}
