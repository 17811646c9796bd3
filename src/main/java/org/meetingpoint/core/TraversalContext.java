package org.meetingpoint.core;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.meetingpoint.search.GenerationVisitedSet;

/**
 * Call-scoped mutable state for one reachability traversal.
 *
 * <p>Distance sums and reach counters accumulate across all per-house passes. The visited
 * set, depth buffer and frontier are reused between houses: callers must invoke
 * {@link #beginHouse()} before every pass after the first.</p>
 */
final class TraversalContext {
    private final long[] distanceSums;
    private final int[] reachCounts;
    private final int[] depthByCell;
    private final GenerationVisitedSet visited;
    private final IntArrayFIFOQueue frontier = new IntArrayFIFOQueue();

    private long visitedCells;
    private int frontierPeak;
    private int housesStarted;

    TraversalContext(int cellCount) {
        this.distanceSums = new long[cellCount];
        this.reachCounts = new int[cellCount];
        this.depthByCell = new int[cellCount];
        this.visited = new GenerationVisitedSet(cellCount);
    }

    /**
     * Prepares a pass for the next house by advancing the visited generation.
     */
    void beginHouse() {
        if (housesStarted > 0) {
            visited.advanceGeneration();
        }
        housesStarted++;
        frontier.clear();
    }

    /**
     * Enqueues a cell at the given depth if it was not reached yet in this pass.
     *
     * @return true when the cell was enqueued.
     */
    boolean offer(int cellId, int depth) {
        if (!visited.markVisited(cellId)) {
            return false;
        }
        depthByCell[cellId] = depth;
        frontier.enqueue(cellId);
        if (frontier.size() > frontierPeak) {
            frontierPeak = frontier.size();
        }
        return true;
    }

    boolean hasFrontier() {
        return !frontier.isEmpty();
    }

    /**
     * Removes the next frontier cell and counts the visit.
     */
    int poll() {
        visitedCells++;
        return frontier.dequeueInt();
    }

    int depth(int cellId) {
        return depthByCell[cellId];
    }

    /**
     * Records that the current house reaches an empty cell at the given distance.
     */
    void accumulate(int cellId, int distance) {
        distanceSums[cellId] += distance;
        reachCounts[cellId]++;
    }

    long distanceSum(int cellId) {
        return distanceSums[cellId];
    }

    int reachCount(int cellId) {
        return reachCounts[cellId];
    }

    long visitedCells() {
        return visitedCells;
    }

    int frontierPeak() {
        return frontierPeak;
    }
}
