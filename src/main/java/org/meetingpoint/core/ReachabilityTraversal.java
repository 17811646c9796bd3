package org.meetingpoint.core;

import org.meetingpoint.grid.CellType;
import org.meetingpoint.grid.Grid;
import org.meetingpoint.grid.HouseSet;

/**
 * Multi-source meeting-point search valid with or without obstacles.
 *
 * <p>Runs one breadth-first pass per house over 4-connected, non-obstacle cells. Every
 * empty cell a pass reaches gets the pass distance added to its sum and its reach counter
 * incremented. A cell qualifies as meeting point only if its reach counter equals the
 * house count. Complexity O(H * M * N).</p>
 */
final class ReachabilityTraversal {

    /**
     * Computes the minimum total distance over empty cells reachable from every house.
     *
     * @param grid non-empty grid.
     * @param houses non-empty house list of {@code grid}.
     * @return meeting plan with traversal counters.
     */
    MeetingPlan compute(Grid grid, HouseSet houses) {
        TraversalContext context = new TraversalContext(grid.cellCount());
        for (int i = 0; i < houses.size(); i++) {
            context.beginHouse();
            expand(grid, houses.cellId(i), context);
        }

        int houseCount = houses.size();
        long best = Long.MAX_VALUE;
        for (int cellId = 0; cellId < grid.cellCount(); cellId++) {
            if (grid.cellType(cellId) == CellType.EMPTY && context.reachCount(cellId) == houseCount) {
                best = Math.min(best, context.distanceSum(cellId));
            }
        }
        return MeetingPlan.of(best, context.visitedCells(), context.frontierPeak());
    }

    /**
     * Breadth-first pass from one house.
     */
    private static void expand(Grid grid, int startCellId, TraversalContext context) {
        int rows = grid.rows();
        int cols = grid.cols();
        context.offer(startCellId, 0);

        while (context.hasFrontier()) {
            int cellId = context.poll();
            int depth = context.depth(cellId);
            if (grid.cellType(cellId) == CellType.EMPTY) {
                context.accumulate(cellId, depth);
            }

            int row = cellId / cols;
            int col = cellId % cols;
            int next = depth + 1;
            if (col + 1 < cols) {
                offerIfEnterable(grid, cellId + 1, next, context);
            }
            if (row + 1 < rows) {
                offerIfEnterable(grid, cellId + cols, next, context);
            }
            if (col > 0) {
                offerIfEnterable(grid, cellId - 1, next, context);
            }
            if (row > 0) {
                offerIfEnterable(grid, cellId - cols, next, context);
            }
        }
    }

    private static void offerIfEnterable(Grid grid, int cellId, int depth, TraversalContext context) {
        if (grid.isEnterable(cellId)) {
            context.offer(cellId, depth);
        }
    }
}
