package org.brainobservatory.nwb;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named data interface grouping ROI response series of one modality.
 */
@Getter
public final class RoiResponseInterface {

    /**
     * Modality stored by the interface.
     */
    public enum Kind {
        FLUORESCENCE,
        DF_OVER_F
    }

    private final String name;
    private final Kind kind;
    @Getter(AccessLevel.NONE)
    private final Map<String, RoiResponseSeries> series = new LinkedHashMap<>();

    public RoiResponseInterface(String name, Kind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static RoiResponseInterface fluorescence(String name) {
        return new RoiResponseInterface(name, Kind.FLUORESCENCE);
    }

    public static RoiResponseInterface dfOverF(String name) {
        return new RoiResponseInterface(name, Kind.DF_OVER_F);
    }

    /**
     * Creates a series and attaches it to this interface.
     *
     * @param name series name, unique within the interface.
     * @param data time-major samples.
     * @param unit unit label.
     * @param rois entity axis, held by reference.
     * @param timestamps time axis, held by reference.
     * @return created series.
     */
    public RoiResponseSeries createRoiResponseSeries(
            String name,
            double[][] data,
            String unit,
            RoiTableRegion rois,
            Timestamps timestamps
    ) {
        Objects.requireNonNull(name, "name");
        if (series.containsKey(name)) {
            throw new IllegalArgumentException(this.name + ": series already exists: " + name);
        }
        RoiResponseSeries created = new RoiResponseSeries(name, data, unit, rois, timestamps);
        series.put(name, created);
        return created;
    }

    public Optional<RoiResponseSeries> getRoiResponseSeries(String name) {
        return Optional.ofNullable(series.get(name));
    }

    public Map<String, RoiResponseSeries> getRoiResponseSeries() {
        return Collections.unmodifiableMap(series);
    }
}
