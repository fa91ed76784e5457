package org.brainobservatory.traces;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of {@link RoiFilter#apply(TraceTable, long[])}: either the filtered table or the offending ids.
 */
public final class RoiFilterResult {
    private static final long[] NONE = new long[0];

    private final TraceTable table;
    private final long[] missingRoiIds;
    private final long[] duplicateRoiIds;

    private RoiFilterResult(TraceTable table, long[] missingRoiIds, long[] duplicateRoiIds) {
        this.table = table;
        this.missingRoiIds = missingRoiIds;
        this.duplicateRoiIds = duplicateRoiIds;
    }

    static RoiFilterResult success(TraceTable table) {
        return new RoiFilterResult(Objects.requireNonNull(table, "table"), NONE, NONE);
    }

    static RoiFilterResult failure(long[] missingRoiIds, long[] duplicateRoiIds) {
        if (missingRoiIds.length == 0 && duplicateRoiIds.length == 0) {
            throw new IllegalArgumentException("failure requires at least one offending id");
        }
        return new RoiFilterResult(
                null,
                Arrays.copyOf(missingRoiIds, missingRoiIds.length),
                Arrays.copyOf(duplicateRoiIds, duplicateRoiIds.length)
        );
    }

    public boolean isSuccess() {
        return table != null;
    }

    /**
     * @return filtered table.
     * @throws IllegalStateException when the filter failed.
     */
    public TraceTable table() {
        if (table == null) {
            throw new IllegalStateException("filter failed; no table available");
        }
        return table;
    }

    /**
     * @return requested ids absent from the source table, in request order.
     */
    public long[] missingRoiIds() {
        return Arrays.copyOf(missingRoiIds, missingRoiIds.length);
    }

    /**
     * @return ids requested more than once, in order of first repetition.
     */
    public long[] duplicateRoiIds() {
        return Arrays.copyOf(duplicateRoiIds, duplicateRoiIds.length);
    }

    /**
     * Returns the filtered table or throws the validation failure this result describes.
     */
    public TraceTable orElseThrow() {
        if (isSuccess()) {
            return table;
        }
        if (missingRoiIds.length > 0) {
            throw new TraceValidationException(
                    TraceValidationException.ROI_IDS_NOT_IN_TRACES,
                    "requested ROI ids not present in source traces: " + Arrays.toString(missingRoiIds)
            );
        }
        throw new TraceValidationException(
                TraceValidationException.DUPLICATE_FILTER_ROI_IDS,
                "requested ROI ids listed more than once: " + Arrays.toString(duplicateRoiIds)
        );
    }
}
