package com.failuresentinel.core.correlation;

/**
 * Mean correlation between the comparable patterns of two floors.
 * {@code floorA <= floorB}; equal floors describe patterns on the same floor.
 *
 * @since 1.0.0
 */
public final class FloorCorrelation {

    private final int floorA;
    private final int floorB;
    private final double meanCorrelation;
    private final int pairCount;

    public FloorCorrelation(int floorA, int floorB, double meanCorrelation, int pairCount) {
        if (floorA > floorB) {
            throw new IllegalArgumentException("floorA must be <= floorB, got: " + floorA + " > " + floorB);
        }
        this.floorA = floorA;
        this.floorB = floorB;
        this.meanCorrelation = meanCorrelation;
        this.pairCount = pairCount;
    }

    public int getFloorA() {
        return floorA;
    }

    public int getFloorB() {
        return floorB;
    }

    public double getMeanCorrelation() {
        return meanCorrelation;
    }

    public int getPairCount() {
        return pairCount;
    }

    @Override
    public String toString() {
        return "FloorCorrelation{" + floorA + "-" + floorB + ", mean=" + meanCorrelation
                + ", pairs=" + pairCount + '}';
    }
}
