package org.meetingpoint.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Raised by the dispatcher when its configuration cannot be honored for a grid.
 *
 * <p>The only such case is a forced {@link MeetingAlgorithm#SEPARABLE_SCAN} on a grid that
 * contains obstacles. Degenerate grids never raise it; they resolve to
 * {@link MeetingPointCore#NO_MEETING_POINT}.</p>
 */
@Getter
public final class MeetingPointException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode one of the {@code REASON_*} constants of {@link MeetingPointCore}.
     * @param message detail appended after the bracketed reason code.
     */
    public MeetingPointException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] " + message);
        this.reasonCode = reasonCode;
    }
}
