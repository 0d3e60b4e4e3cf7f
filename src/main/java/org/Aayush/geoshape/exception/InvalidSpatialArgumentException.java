package org.Aayush.geoshape.exception;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised when a query or configuration precondition is violated.
 */
@Getter
@Accessors(fluent = true)
public final class InvalidSpatialArgumentException extends RuntimeException {
    public static final String REASON_TARGET_NEEDS_AREA = "TARGET_NEEDS_AREA";
    public static final String REASON_MISSING_SHAPE = "MISSING_SHAPE";
    public static final String REASON_DIST_ERR_PCT_RANGE = "DIST_ERR_PCT_RANGE";
    public static final String REASON_BAD_GEOHASH_CHAR = "BAD_GEOHASH_CHAR";
    public static final String REASON_BAD_GEOHASH_PRECISION = "BAD_GEOHASH_PRECISION";
    public static final String REASON_LATITUDE_OUT_OF_RANGE = "LATITUDE_OUT_OF_RANGE";
    public static final String REASON_UNKNOWN_CALCULATOR = "UNKNOWN_CALCULATOR";
    public static final String REASON_UNKNOWN_OPERATION = "UNKNOWN_OPERATION";
    public static final String REASON_BAD_CONFIG_VALUE = "BAD_CONFIG_VALUE";
    public static final String REASON_UNSUPPORTED_SHAPE_TYPE = "UNSUPPORTED_SHAPE_TYPE";

    private final String reasonCode;

    /**
     * Creates a reason-coded argument failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public InvalidSpatialArgumentException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded argument failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public InvalidSpatialArgumentException(String reasonCode, String message, Throwable cause) {
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
