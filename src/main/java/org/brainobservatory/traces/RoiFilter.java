package org.brainobservatory.traces;

import it.unimi.dsi.fastutil.longs.LongLinkedOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Restricts a trace table to a requested subset of ROI ids.
 *
 * <p>Pure: never throws for bad ids, the outcome is reported through {@link RoiFilterResult}.</p>
 */
@UtilityClass
public final class RoiFilter {

    /**
     * Selects {@code roiIds} from {@code traces}, in the order given.
     *
     * @param traces source table.
     * @param roiIds requested ids.
     * @return success with the filtered table, or failure listing missing and duplicate ids.
     */
    public static RoiFilterResult apply(TraceTable traces, long[] roiIds) {
        Objects.requireNonNull(traces, "traces");
        Objects.requireNonNull(roiIds, "roiIds");

        LongLinkedOpenHashSet missing = new LongLinkedOpenHashSet();
        LongLinkedOpenHashSet duplicates = new LongLinkedOpenHashSet();
        LongOpenHashSet seen = new LongOpenHashSet(roiIds.length);
        for (long roiId : roiIds) {
            if (!traces.contains(roiId)) {
                missing.add(roiId);
            } else if (!seen.add(roiId)) {
                duplicates.add(roiId);
            }
        }
        if (!missing.isEmpty() || !duplicates.isEmpty()) {
            return RoiFilterResult.failure(missing.toLongArray(), duplicates.toLongArray());
        }
        return RoiFilterResult.success(traces.select(roiIds));
    }
}
