package org.brainobservatory.nwb;

import lombok.Getter;
import org.brainobservatory.core.id.RoiIdIndex;

import java.util.Objects;

/**
 * Ordered table of segmented ROIs (plane segmentation). Row order is the container order.
 */
public final class RoiTable {
    @Getter
    private final String name;
    private final RoiIdIndex index;

    public RoiTable(String name, long[] roiIds) {
        this.name = Objects.requireNonNull(name, "name");
        this.index = RoiIdIndex.of(roiIds);
    }

    public int size() {
        return index.size();
    }

    public long idAt(int row) {
        return index.toRoiId(row);
    }

    public long[] idsCopy() {
        return index.roiIdsCopy();
    }

    public boolean contains(long roiId) {
        return index.contains(roiId);
    }

    /**
     * @return row of the ROI id in this table.
     * @throws RoiIdIndex.UnknownRoiIdException when the id is absent.
     */
    public int rowOf(long roiId) {
        return index.toRow(roiId);
    }
}
