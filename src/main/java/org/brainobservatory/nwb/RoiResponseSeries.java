package org.brainobservatory.nwb;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Time-major ROI response series: {@code data[t][r]} is the sample of region row {@code r} at timestamp {@code t}.
 *
 * <p>Row count must equal the timestamp count and every row width must equal the region size.
 * Region and timestamps are held by reference; sample data is copied in and out.</p>
 */
@Getter
public final class RoiResponseSeries {
    private final String name;
    private final String unit;
    private final RoiTableRegion rois;
    private final Timestamps timestamps;
    @Getter(AccessLevel.NONE)
    private final double[][] data;

    RoiResponseSeries(String name, double[][] data, String unit, RoiTableRegion rois, Timestamps timestamps) {
        this.name = Objects.requireNonNull(name, "name");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.rois = Objects.requireNonNull(rois, "rois");
        this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
        this.data = copyAndValidateData(data, timestamps.count(), rois.size(), name);
    }

    public int timepointCount() {
        return data.length;
    }

    public int roiCount() {
        return rois.size();
    }

    /**
     * Returns a defensive copy of the time-major sample matrix.
     */
    public double[][] dataCopy() {
        double[][] copy = new double[data.length][];
        for (int t = 0; t < data.length; t++) {
            copy[t] = Arrays.copyOf(data[t], data[t].length);
        }
        return copy;
    }

    public AxisDescriptor axisDescriptor() {
        return AxisDescriptor.of(this);
    }

    private static double[][] copyAndValidateData(double[][] data, int timepoints, int roiCount, String name) {
        Objects.requireNonNull(data, "data");
        if (data.length != timepoints) {
            throw new IllegalArgumentException(
                    name + ": data has " + data.length + " timepoints but timestamps has " + timepoints
            );
        }
        double[][] copy = new double[data.length][];
        for (int t = 0; t < data.length; t++) {
            double[] row = Objects.requireNonNull(data[t], name + ": data[" + t + "]");
            if (row.length != roiCount) {
                throw new IllegalArgumentException(
                        name + ": data[" + t + "] width mismatch: " + row.length + " != " + roiCount
                );
            }
            copy[t] = Arrays.copyOf(row, row.length);
        }
        return copy;
    }
}
