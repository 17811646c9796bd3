package org.meetingpoint.core;

import lombok.Builder;
import lombok.Value;

/**
 * Meeting-point computation result with routing metadata.
 *
 * <p>When {@code found=false}, {@code totalDistance} is {@link MeetingPointCore#NO_MEETING_POINT}.
 * {@code algorithm} is {@code null} when the dispatcher short-circuits a grid without
 * cells or without houses.</p>
 */
@Value
@Builder
public class MeetingPointResponse {
    /** Whether an empty cell reachable from every house exists. */
    boolean found;
    /** Minimum total distance from all houses, or the sentinel. */
    long totalDistance;
    /** Algorithm that produced this response. */
    MeetingAlgorithm algorithm;
    /** Grid row count. */
    int rows;
    /** Grid column count. */
    int cols;
    /** Number of houses in the grid. */
    int houseCount;
    /** Number of obstacle cells in the grid. */
    int obstacleCount;
    /** Cell visits performed by the traversal ({@code 0} for the scan). */
    long visitedCells;
    /** Largest traversal frontier observed ({@code 0} for the scan). */
    int frontierPeak;
}
