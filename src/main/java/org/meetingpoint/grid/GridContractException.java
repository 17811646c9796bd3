package org.meetingpoint.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a raw grid does not satisfy the rectangular-grid contract.
 *
 * <p>Degenerate but well-formed grids (no rows, zero-width first row) are not
 * contract failures. Messages are prefixed with the reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GridContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded grid contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public GridContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
