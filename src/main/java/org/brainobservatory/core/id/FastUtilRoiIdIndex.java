package org.brainobservatory.core.id;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

import java.util.Arrays;

/**
 * RoiIdIndex backed by a fastutil primitive map.
 * Row positions follow the order of the ids passed at construction.
 * This class is immutable and thread-safe for concurrent reads.
 */
public class FastUtilRoiIdIndex implements RoiIdIndex {

    private static final int MISSING = -1;

    // roi id -> row, no boxing
    private final Long2IntOpenHashMap forward;
    // row -> roi id
    private final long[] reverse;

    /**
     * Builds the index from ids in row order.
     * Rejects duplicate ids.
     */
    public FastUtilRoiIdIndex(long[] roiIds) {
        if (roiIds == null) {
            throw new IllegalArgumentException("ROI ids cannot be null");
        }
        this.reverse = Arrays.copyOf(roiIds, roiIds.length);
        this.forward = new Long2IntOpenHashMap(roiIds.length);
        this.forward.defaultReturnValue(MISSING);

        for (int row = 0; row < reverse.length; row++) {
            int previous = forward.put(reverse[row], row);
            if (previous != MISSING) {
                throw new IllegalArgumentException(
                        "Duplicate ROI id " + reverse[row] + " at rows " + previous + " and " + row
                );
            }
        }
        this.forward.trim();
    }

    @Override
    public int toRow(long roiId) throws UnknownRoiIdException {
        int row = forward.get(roiId);
        if (row == MISSING) {
            throw new UnknownRoiIdException("ROI id not found: " + roiId);
        }
        return row;
    }

    @Override
    public long toRoiId(int row) {
        try {
            return reverse[row];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Row out of bounds: " + row);
        }
    }

    @Override
    public boolean contains(long roiId) {
        return forward.containsKey(roiId);
    }

    @Override
    public int size() {
        return reverse.length;
    }

    @Override
    public long[] roiIdsCopy() {
        return Arrays.copyOf(reverse, reverse.length);
    }
}
