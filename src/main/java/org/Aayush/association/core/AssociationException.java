package org.Aayush.association.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure raised by association code when an input, a collaborator or the configuration breaks
 * its contract.
 *
 * <p>{@link #getReasonCode()} is one of the {@code REASON_*} constants below (or a caller-defined
 * code) and is repeated as a {@code [CODE]} prefix of the message.</p>
 */
@Getter
public final class AssociationException extends RuntimeException {
    public static final String REASON_COST_MATRIX_DIMENSION_MISMATCH = "ASSOC_COST_MATRIX_DIMENSION_MISMATCH";
    public static final String REASON_INVALID_SOLVER_INPUT = "ASSOC_INVALID_SOLVER_INPUT";
    public static final String REASON_INVALID_SOLVER_OUTPUT = "ASSOC_INVALID_SOLVER_OUTPUT";
    public static final String REASON_INVALID_COST = "ASSOC_INVALID_COST";
    public static final String REASON_INVALID_INDEX = "ASSOC_INVALID_INDEX";
    public static final String REASON_DUPLICATE_INDEX = "ASSOC_DUPLICATE_INDEX";
    public static final String REASON_METRIC_RESULT_REQUIRED = "ASSOC_METRIC_RESULT_REQUIRED";
    public static final String REASON_GATING_FAILED = "ASSOC_GATING_FAILED";
    public static final String REASON_UNKNOWN_SOLVER = "ASSOC_UNKNOWN_SOLVER";
    public static final String REASON_INVALID_CONFIG = "ASSOC_INVALID_CONFIG";

    private final String reasonCode;

    public AssociationException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * @param reasonCode non-blank code, usually a {@code REASON_*} constant.
     * @param message detail appended after the code.
     * @param cause underlying failure, may be null.
     */
    public AssociationException(String reasonCode, String message, Throwable cause) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    private static String checkedCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
