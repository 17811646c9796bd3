package org.meetingpoint.grid;

/**
 * Closed three-way classification of one grid cell.
 *
 * <p>Only the raw markers {@link #EMPTY_MARKER} and {@link #HOUSE_MARKER} are reserved;
 * every other raw value classifies as {@link #OBSTACLE}.</p>
 */
public enum CellType {
    EMPTY,
    HOUSE,
    OBSTACLE;

    public static final int EMPTY_MARKER = 0;
    public static final int HOUSE_MARKER = 1;
    /** Raw value written for obstacles by grid producers. */
    public static final int OBSTACLE_MARKER = 2;

    /**
     * Classifies one raw grid value.
     *
     * @param raw raw cell value.
     * @return cell classification.
     */
    public static CellType classify(int raw) {
        return switch (raw) {
            case EMPTY_MARKER -> EMPTY;
            case HOUSE_MARKER -> HOUSE;
            default -> OBSTACLE;
        };
    }

    /**
     * Returns whether a traversal may step onto a cell of this type.
     */
    public boolean isEnterable() {
        return this != OBSTACLE;
    }

    /**
     * Returns the canonical raw marker for this type.
     */
    public int marker() {
        return switch (this) {
            case EMPTY -> EMPTY_MARKER;
            case HOUSE -> HOUSE_MARKER;
            case OBSTACLE -> OBSTACLE_MARKER;
        };
    }
}
