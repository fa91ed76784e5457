package org.brainobservatory.traces;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base of the reason-coded failures raised while reading or writing trace tables.
 *
 * <p>Messages are prefixed with the reason code, for example {@code [INDEX_NAME_MISMATCH] ...}.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class TraceAdapterException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded trace adapter failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    protected TraceAdapterException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Formats exception message with deterministic reason-code prefix.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    /**
     * Validates reason-code contract.
     */
    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
