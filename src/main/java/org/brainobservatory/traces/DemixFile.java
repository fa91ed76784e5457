package org.brainobservatory.traces;

/**
 * Output of the demixing step: corrected fluorescence per ROI, already entity-major.
 */
@FunctionalInterface
public interface DemixFile {

    /**
     * @return traces indexed by {@code cell_roi_id}, one row per ROI.
     */
    TraceTable getData();
}
