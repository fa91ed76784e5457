package org.brainobservatory.nwb;

import lombok.Value;

import java.util.Objects;

/**
 * Borrowed axis metadata of an existing ROI response series.
 *
 * <p>Holds the entity axis and time axis by reference. Nothing is copied, so a series created
 * from a descriptor shares both axes with the series it was taken from.</p>
 */
@Value
public class AxisDescriptor {
    /** Entity axis (ROI rows). */
    RoiTableRegion rois;
    /** Time axis. */
    Timestamps timestamps;

    public static AxisDescriptor of(RoiResponseSeries series) {
        Objects.requireNonNull(series, "series");
        return new AxisDescriptor(series.getRois(), series.getTimestamps());
    }

    public int roiCount() {
        return rois.size();
    }

    public int timepointCount() {
        return timestamps.count();
    }
}
