package com.failuresentinel.core.detection;

import com.failuresentinel.core.model.EquipmentType;
import com.failuresentinel.core.model.TimeSeriesPoint;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Readings of one sensor in timestamp order, unpacked into parallel arrays.
 */
final class SensorSeries {

    private final String sensorId;
    private final EquipmentType equipmentType;
    private final Integer floorNumber;
    private final Instant[] timestamps;
    private final double[] values;

    private SensorSeries(String sensorId, EquipmentType equipmentType, Integer floorNumber,
            Instant[] timestamps, double[] values) {
        this.sensorId = sensorId;
        this.equipmentType = equipmentType;
        this.floorNumber = floorNumber;
        this.timestamps = timestamps;
        this.values = values;
    }

    /**
     * @param sensorId sensor the points belong to
     * @param points   non-empty readings of that sensor; sorted in place
     */
    static SensorSeries of(String sensorId, List<TimeSeriesPoint> points) {
        points.sort(Comparator.comparing(TimeSeriesPoint::getTimestamp));
        int n = points.size();
        Instant[] timestamps = new Instant[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            timestamps[i] = points.get(i).getTimestamp();
            values[i] = points.get(i).getValue();
        }
        TimeSeriesPoint first = points.get(0);
        return new SensorSeries(sensorId, first.getEquipmentType(), first.getFloorNumber(),
                timestamps, values);
    }

    String sensorId() {
        return sensorId;
    }

    EquipmentType equipmentType() {
        return equipmentType;
    }

    Integer floorNumber() {
        return floorNumber;
    }

    Instant[] timestamps() {
        return timestamps;
    }

    double[] values() {
        return values;
    }

    int size() {
        return values.length;
    }
}
