package org.Aayush.geoshape.exception;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised when a shape's defining parameters are geometrically impossible.
 *
 * <p>Construction-time failure; shapes are never silently repaired.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InvalidShapeException extends RuntimeException {
    public static final String REASON_INVALID_Y_RANGE = "INVALID_Y_RANGE";
    public static final String REASON_Y_OUT_OF_BOUNDS = "Y_OUT_OF_BOUNDS";
    public static final String REASON_X_OUT_OF_BOUNDS = "X_OUT_OF_BOUNDS";
    public static final String REASON_MIXED_NAN = "MIXED_NAN";
    public static final String REASON_CARTESIAN_X_INVERTED = "CARTESIAN_X_INVERTED";
    public static final String REASON_NEGATIVE_RADIUS = "NEGATIVE_RADIUS";
    public static final String REASON_NEGATIVE_BUFFER = "NEGATIVE_BUFFER";
    public static final String REASON_UNSUPPORTED_DATELINE = "UNSUPPORTED_DATELINE";
    public static final String REASON_INVALID_GEOMETRY = "INVALID_GEOMETRY";

    private final String reasonCode;

    /**
     * Creates a reason-coded shape failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public InvalidShapeException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded shape failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public InvalidShapeException(String reasonCode, String message, Throwable cause) {
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
