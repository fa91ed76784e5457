package org.brainobservatory.traces;

/**
 * Identity, alignment or shape contract broken by the caller.
 */
public final class TraceInvariantException extends TraceAdapterException {
    public static final String INDEX_NAME_MISMATCH = "INDEX_NAME_MISMATCH";
    public static final String ROI_ALIGNMENT_MISMATCH = "ROI_ALIGNMENT_MISMATCH";
    public static final String TIMESTAMP_COUNT_MISMATCH = "TIMESTAMP_COUNT_MISMATCH";
    public static final String TARGET_ALREADY_PRESENT = "TARGET_ALREADY_PRESENT";

    public TraceInvariantException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
