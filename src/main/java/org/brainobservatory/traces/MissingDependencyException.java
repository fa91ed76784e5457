package org.brainobservatory.traces;

/**
 * A container block the operation depends on has not been written yet.
 */
public final class MissingDependencyException extends TraceAdapterException {
    public static final String PROCESSING_MODULE_MISSING = "PROCESSING_MODULE_MISSING";
    public static final String COMPANION_MODALITY_MISSING = "COMPANION_MODALITY_MISSING";
    public static final String CONTAINER_BLOCK_MISSING = "CONTAINER_BLOCK_MISSING";

    public MissingDependencyException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
