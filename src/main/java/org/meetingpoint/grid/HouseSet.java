package org.meetingpoint.grid;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Ordered, immutable list of house coordinates of one grid.
 *
 * <p>Houses are stored as packed cell ids ({@code row * cols + col}) in row-major order.</p>
 */
public final class HouseSet {
    private final int[] cellIds;
    private final int cols;

    private HouseSet(int[] cellIds, int cols) {
        this.cellIds = cellIds;
        this.cols = cols;
    }

    /**
     * Collects the houses of a grid in row-major order.
     *
     * @param grid classified grid.
     * @return house set (empty for degenerate grids).
     */
    public static HouseSet of(Grid grid) {
        IntArrayList houses = new IntArrayList();
        for (int cellId = 0; cellId < grid.cellCount(); cellId++) {
            if (grid.cellType(cellId) == CellType.HOUSE) {
                houses.add(cellId);
            }
        }
        return new HouseSet(houses.toIntArray(), grid.cols());
    }

    public int size() {
        return cellIds.length;
    }

    public boolean isEmpty() {
        return cellIds.length == 0;
    }

    public int cellId(int index) {
        return cellIds[index];
    }

    public int row(int index) {
        return cellIds[index] / cols;
    }

    public int col(int index) {
        return cellIds[index] % cols;
    }
}
