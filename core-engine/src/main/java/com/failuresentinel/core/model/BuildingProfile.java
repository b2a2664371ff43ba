package com.failuresentinel.core.model;

/**
 * Physical and operational profile of the monitored building.
 *
 * @since 1.0.0
 */
public final class BuildingProfile {

    private final int floors;
    private final int sensorCount;
    private final double operationalHoursPerDay;

    /**
     * @param floors                 number of floors, at least 1
     * @param sensorCount            number of deployed sensors, not negative
     * @param operationalHoursPerDay occupied hours per day, in {@code (0, 24]}
     * @throws IllegalArgumentException if any value is out of range
     */
    public BuildingProfile(int floors, int sensorCount, double operationalHoursPerDay) {
        if (floors < 1) {
            throw new IllegalArgumentException("floors must be >= 1, got: " + floors);
        }
        if (sensorCount < 0) {
            throw new IllegalArgumentException("sensorCount must be >= 0, got: " + sensorCount);
        }
        if (!(operationalHoursPerDay > 0 && operationalHoursPerDay <= 24)) {
            throw new IllegalArgumentException(
                    "operationalHoursPerDay must be in (0, 24], got: " + operationalHoursPerDay);
        }
        this.floors = floors;
        this.sensorCount = sensorCount;
        this.operationalHoursPerDay = operationalHoursPerDay;
    }

    public int getFloors() {
        return floors;
    }

    public int getSensorCount() {
        return sensorCount;
    }

    public double getOperationalHoursPerDay() {
        return operationalHoursPerDay;
    }

    @Override
    public String toString() {
        return "BuildingProfile{floors=" + floors + ", sensorCount=" + sensorCount
                + ", operationalHoursPerDay=" + operationalHoursPerDay + '}';
    }
}
