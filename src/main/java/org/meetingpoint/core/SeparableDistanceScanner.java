package org.meetingpoint.core;

import org.meetingpoint.grid.CellType;
import org.meetingpoint.grid.Grid;
import org.meetingpoint.grid.HouseSet;

/**
 * Closed-form meeting-point scan for obstacle-free grids.
 *
 * <p>Without obstacles every empty cell is reachable from every house along a Manhattan
 * path, so the total distance to cell {@code (r, c)} splits into a row term
 * {@code sum |house.row - r|} and a column term {@code sum |house.col - c|}. Both terms
 * are evaluated for all rows and columns with one forward and one backward sweep over
 * per-row and per-column house counts, giving O(M*N + H) overall.</p>
 *
 * <p>Callers must guarantee the grid contains no obstacles. The precondition is not
 * checked here; on a grid with obstacles the result is silently wrong.</p>
 */
final class SeparableDistanceScanner {

    /**
     * Computes the minimum total distance over all empty cells.
     *
     * @param grid obstacle-free, non-empty grid.
     * @param houses non-empty house list of {@code grid}.
     * @return meeting plan; not found when the grid has no empty cell.
     */
    MeetingPlan compute(Grid grid, HouseSet houses) {
        int rows = grid.rows();
        int cols = grid.cols();

        int[] housesPerRow = new int[rows];
        int[] housesPerCol = new int[cols];
        for (int i = 0; i < houses.size(); i++) {
            housesPerRow[houses.row(i)]++;
            housesPerCol[houses.col(i)]++;
        }

        long[] rowCost = axisCosts(housesPerRow);
        long[] colCost = axisCosts(housesPerCol);

        long best = Long.MAX_VALUE;
        for (int row = 0; row < rows; row++) {
            int base = row * cols;
            for (int col = 0; col < cols; col++) {
                if (grid.cellType(base + col) == CellType.EMPTY) {
                    best = Math.min(best, rowCost[row] + colCost[col]);
                }
            }
        }
        return MeetingPlan.of(best, 0L, 0);
    }

    /**
     * Returns, for every axis position, the summed distance to all houses along that axis.
     */
    static long[] axisCosts(int[] housesAt) {
        int length = housesAt.length;
        long[] costs = new long[length];

        // houses strictly before p each move one step further when p advances
        long housesBefore = 0L;
        long running = 0L;
        for (int p = 0; p < length; p++) {
            running += housesBefore;
            costs[p] = running;
            housesBefore += housesAt[p];
        }

        long housesAfter = 0L;
        running = 0L;
        for (int p = length - 1; p >= 0; p--) {
            running += housesAfter;
            costs[p] += running;
            housesAfter += housesAt[p];
        }
        return costs;
    }
}
