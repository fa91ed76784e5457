package org.brainobservatory.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between external {@code cell_roi_id} values and dense row positions.
 */
public interface RoiIdIndex {

    /**
     * Converts an external ROI id to its row position.
     * @param roiId The externally assigned ROI id.
     * @return The zero-based row position.
     * @throws UnknownRoiIdException If the id is not indexed.
     */
    int toRow(long roiId) throws UnknownRoiIdException;

    /**
     * Converts a row position to its external ROI id.
     * @param row The zero-based row position.
     * @return The externally assigned ROI id.
     * @throws IndexOutOfBoundsException If the row is invalid.
     */
    long toRoiId(int row);

    /**
     * Checks whether an ROI id is indexed.
     *
     * @param roiId ROI id to test.
     * @return true when the id is present.
     */
    boolean contains(long roiId);

    /**
     * Returns number of indexed ROI ids.
     *
     * @return total index size.
     */
    int size();

    /**
     * Returns the indexed ids in row order.
     *
     * @return a fresh copy of the ids.
     */
    long[] roiIdsCopy();

    /**
     * Exception thrown when an ROI id cannot be found in the index.
     */
    @StandardException
    class UnknownRoiIdException extends RuntimeException {
    }

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param roiIds ROI ids in row order. Ids must be unique.
     * @return An immutable RoiIdIndex instance.
     */
    static RoiIdIndex of(long[] roiIds) {
        return new FastUtilRoiIdIndex(roiIds);
    }
}
