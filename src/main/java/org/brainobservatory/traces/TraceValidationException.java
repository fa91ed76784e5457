package org.brainobservatory.traces;

/**
 * Requested input is inconsistent with the source traces (for example unknown filter ids).
 */
public final class TraceValidationException extends TraceAdapterException {
    public static final String ROI_IDS_NOT_IN_TRACES = "ROI_IDS_NOT_IN_TRACES";
    public static final String DUPLICATE_FILTER_ROI_IDS = "DUPLICATE_FILTER_ROI_IDS";

    public TraceValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
