package org.meetingpoint.core;

/**
 * Internal algorithm output.
 *
 * @param found whether a valid meeting cell exists.
 * @param totalDistance minimum total distance (or the sentinel when not found).
 * @param visitedCells traversal cell visits across all houses ({@code 0} for the scanner).
 * @param frontierPeak largest frontier size observed ({@code 0} for the scanner).
 */
record MeetingPlan(boolean found, long totalDistance, long visitedCells, int frontierPeak) {

    static MeetingPlan of(long bestDistance, long visitedCells, int frontierPeak) {
        if (bestDistance == Long.MAX_VALUE) {
            return notFound(visitedCells, frontierPeak);
        }
        return new MeetingPlan(true, bestDistance, visitedCells, frontierPeak);
    }

    /**
     * Creates a canonical no-meeting-point result.
     */
    static MeetingPlan notFound(long visitedCells, int frontierPeak) {
        return new MeetingPlan(false, MeetingPointCore.NO_MEETING_POINT, visitedCells, frontierPeak);
    }
}
