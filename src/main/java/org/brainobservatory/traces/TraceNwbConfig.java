package org.brainobservatory.traces;

import lombok.Builder;
import lombok.Value;

/**
 * Naming convention used to locate and create the corrected fluorescence block in a container.
 */
@Value
@Builder(toBuilder = true)
public class TraceNwbConfig {

    /**
     * Companion modality conventionally written before corrected fluorescence.
     */
    public static final String DEFAULT_COMPANION_INTERFACE = "dff";

    /** Processing module holding optical physiology results. */
    @Builder.Default
    String processingModuleName = "ophys";

    /** Data interface the traces are written to and read from. */
    @Builder.Default
    String interfaceName = "corrected_fluorescence";

    /** Series name inside both the target and the companion interface. */
    @Builder.Default
    String seriesName = "traces";

    /** Unit label; traces are unitless. */
    @Builder.Default
    String unit = "NA";

    /** Index name the table must carry to be written. */
    @Builder.Default
    String requiredIndexName = TraceTable.CELL_ROI_ID;

    /**
     * Returns the standard container layout.
     */
    public static TraceNwbConfig defaults() {
        return TraceNwbConfig.builder().build();
    }
}
