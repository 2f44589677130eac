package org.Aayush.exogenous;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded failure raised when reference tables or provider configuration cannot be bound.
 *
 * <p>Messages are prefixed with the reason code so log lines stay greppable.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ProjectionException extends RuntimeException {
    public static final String REASON_CONFIG_INVALID = "EX_CONFIG_INVALID";
    public static final String REASON_SCENARIO_NOT_FOUND = "EX_SCENARIO_NOT_FOUND";
    public static final String REASON_MODEL_NOT_FOUND = "EX_MODEL_NOT_FOUND";
    public static final String REASON_COLUMN_MISSING = "EX_COLUMN_MISSING";
    public static final String REASON_TABLE_READ_FAILED = "EX_TABLE_READ_FAILED";
    public static final String REASON_YEAR_ABOVE_HORIZON = "EX_YEAR_ABOVE_HORIZON";
    public static final String REASON_COUNTRY_TOTAL_MISSING = "EX_COUNTRY_TOTAL_MISSING";

    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public ProjectionException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     * @param cause underlying exception.
     */
    public ProjectionException(String reasonCode, String message, Throwable cause) {
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
