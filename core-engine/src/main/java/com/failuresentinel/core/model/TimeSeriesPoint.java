package com.failuresentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Single sensor reading supplied by the external data feed.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #of(String, EquipmentType, Instant, double)} for the common case
 * or the {@link Builder} when a floor number is known. {@code timestamp},
 * {@code sensorId} and {@code equipmentType} are required. The value itself
 * is not checked here: the detector skips non-finite readings and counts them.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeriesPoint {

    private final Instant timestamp;
    private final double value;
    private final String sensorId;
    private final EquipmentType equipmentType;
    private final Integer floorNumber;

    private TimeSeriesPoint(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.sensorId = Objects.requireNonNull(builder.sensorId, "sensorId must not be null");
        this.equipmentType = Objects.requireNonNull(builder.equipmentType, "equipmentType must not be null");
        this.value = builder.value;
        this.floorNumber = builder.floorNumber;
    }

    public static TimeSeriesPoint of(String sensorId, EquipmentType equipmentType,
            Instant timestamp, double value) {
        return builder()
                .sensorId(sensorId)
                .equipmentType(equipmentType)
                .timestamp(timestamp)
                .value(value)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant timestamp;
        private double value;
        private String sensorId;
        private EquipmentType equipmentType;
        private Integer floorNumber;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder equipmentType(EquipmentType equipmentType) {
            this.equipmentType = equipmentType;
            return this;
        }

        public Builder floorNumber(Integer floorNumber) {
            this.floorNumber = floorNumber;
            return this;
        }

        /**
         * @return a new {@link TimeSeriesPoint}
         * @throws NullPointerException if a required field is missing
         */
        public TimeSeriesPoint build() {
            return new TimeSeriesPoint(this);
        }
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public String getSensorId() {
        return sensorId;
    }

    public EquipmentType getEquipmentType() {
        return equipmentType;
    }

    /**
     * @return the floor the sensor is mounted on, or {@code null} if unknown
     */
    public Integer getFloorNumber() {
        return floorNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeriesPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && timestamp.equals(that.timestamp)
                && sensorId.equals(that.sensorId)
                && equipmentType == that.equipmentType
                && Objects.equals(floorNumber, that.floorNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value, sensorId, equipmentType, floorNumber);
    }

    @Override
    public String toString() {
        return "TimeSeriesPoint{" +
                "sensorId='" + sensorId + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", equipmentType=" + equipmentType +
                ", floorNumber=" + floorNumber +
                '}';
    }
}
