package org.Aayush.tsp.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Solver-facade contract exception with deterministic reason codes.
 */
@Getter
public final class TourCoreException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded facade failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public TourCoreException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded facade failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public TourCoreException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
