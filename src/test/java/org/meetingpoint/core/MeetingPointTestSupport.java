package org.meetingpoint.core;

import org.meetingpoint.grid.CellType;
import org.meetingpoint.grid.Grid;
import org.meetingpoint.grid.HouseSet;

/**
 * Reference computations shared by core tests.
 */
final class MeetingPointTestSupport {

    private MeetingPointTestSupport() {
    }

    /**
     * Direct O(M*N*H) Manhattan minimum over empty cells, valid for obstacle-free grids.
     */
    static long directManhattanMinimum(Grid grid) {
        HouseSet houses = grid.houses();
        long best = Long.MAX_VALUE;
        for (int row = 0; row < grid.rows(); row++) {
            for (int col = 0; col < grid.cols(); col++) {
                if (grid.cellType(row, col) != CellType.EMPTY) {
                    continue;
                }
                long total = 0L;
                for (int i = 0; i < houses.size(); i++) {
                    total += Math.abs(houses.row(i) - row) + Math.abs(houses.col(i) - col);
                }
                best = Math.min(best, total);
            }
        }
        return best == Long.MAX_VALUE ? MeetingPointCore.NO_MEETING_POINT : best;
    }
}
