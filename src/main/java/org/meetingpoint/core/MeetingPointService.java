package org.meetingpoint.core;

/**
 * Public meeting-point service contract.
 *
 * <p>Degenerate grids resolve to the sentinel; only malformed input raises
 * reason-coded runtime exceptions.</p>
 */
public interface MeetingPointService {
    /**
     * Computes the minimum total distance from every house to one common empty cell.
     *
     * @param grid raw grid, {@code 0} empty, {@code 1} house, anything else obstacle.
     * @return minimum total distance, or {@code -1} when no valid meeting cell exists.
     */
    long solve(int[][] grid);

    /**
     * Computes the meeting point and reports how it was obtained.
     *
     * @param grid raw grid.
     * @return response with distance, selected algorithm and traversal counters.
     */
    MeetingPointResponse plan(int[][] grid);
}
