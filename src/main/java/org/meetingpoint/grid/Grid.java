package org.meetingpoint.grid;

/**
 * Immutable row-major view of a classified MxN grid.
 *
 * <p>The raw input is copied and classified once; the house list and the obstacle/empty
 * counts are derived at construction. Cells are addressed either by {@code (row, col)}
 * or by packed id {@code row * cols + col}.</p>
 *
 * <p>An input with no rows, or whose first row has zero length, yields the degenerate
 * empty grid ({@code rows() == 0 || cols() == 0}).</p>
 */
public final class Grid {
    public static final String REASON_GRID_REQUIRED = "GRID_REQUIRED";
    public static final String REASON_ROW_REQUIRED = "GRID_ROW_REQUIRED";
    public static final String REASON_RAGGED_ROW = "GRID_RAGGED_ROW";

    private static final CellType[] TYPES = CellType.values();
    private static final Grid EMPTY = new Grid(0, 0, new byte[0]);

    private final int rows;
    private final int cols;
    private final byte[] cells;
    private final int obstacleCount;
    private final int emptyCount;
    private final HouseSet houses;

    private Grid(int rows, int cols, byte[] cells) {
        this.rows = rows;
        this.cols = cols;
        this.cells = cells;

        int obstacles = 0;
        int empties = 0;
        for (byte cell : cells) {
            CellType type = TYPES[cell];
            if (type == CellType.OBSTACLE) {
                obstacles++;
            } else if (type == CellType.EMPTY) {
                empties++;
            }
        }
        this.obstacleCount = obstacles;
        this.emptyCount = empties;
        this.houses = HouseSet.of(this);
    }

    /**
     * Classifies a raw grid.
     *
     * @param raw raw grid, {@code 0} empty, {@code 1} house, anything else obstacle.
     * @return immutable classified grid.
     * @throws GridContractException when the grid or one of its rows is null, or rows differ in length.
     */
    public static Grid of(int[][] raw) {
        if (raw == null) {
            throw new GridContractException(REASON_GRID_REQUIRED, "grid must be provided");
        }
        if (raw.length == 0) {
            return EMPTY;
        }
        if (raw[0] == null) {
            throw new GridContractException(REASON_ROW_REQUIRED, "row 0 must be non-null");
        }
        if (raw[0].length == 0) {
            return EMPTY;
        }

        int rows = raw.length;
        int cols = raw[0].length;
        byte[] cells = new byte[Math.multiplyExact(rows, cols)];
        for (int row = 0; row < rows; row++) {
            int[] values = raw[row];
            if (values == null) {
                throw new GridContractException(REASON_ROW_REQUIRED, "row " + row + " must be non-null");
            }
            if (values.length != cols) {
                throw new GridContractException(
                        REASON_RAGGED_ROW,
                        "row " + row + " has length " + values.length + ", expected " + cols
                );
            }
            int base = row * cols;
            for (int col = 0; col < cols; col++) {
                cells[base + col] = (byte) CellType.classify(values[col]).ordinal();
            }
        }
        return new Grid(rows, cols, cells);
    }

    /**
     * Returns the shared degenerate grid.
     */
    public static Grid empty() {
        return EMPTY;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int cellCount() {
        return cells.length;
    }

    public boolean isEmpty() {
        return cells.length == 0;
    }

    public CellType cellType(int cellId) {
        return TYPES[cells[cellId]];
    }

    public CellType cellType(int row, int col) {
        return TYPES[cells[cellId(row, col)]];
    }

    /**
     * Returns whether a traversal may enter the cell (EMPTY or HOUSE).
     */
    public boolean isEnterable(int cellId) {
        return cellType(cellId).isEnterable();
    }

    public int cellId(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("cell (" + row + ", " + col + ") outside " + rows + "x" + cols);
        }
        return row * cols + col;
    }

    /**
     * Returns the ordered house list derived at construction.
     */
    public HouseSet houses() {
        return houses;
    }

    public boolean hasObstacles() {
        return obstacleCount > 0;
    }

    public int obstacleCount() {
        return obstacleCount;
    }

    public int emptyCount() {
        return emptyCount;
    }

    /**
     * Rebuilds a canonical raw grid ({@code 0}/{@code 1}/{@code 2}).
     */
    public int[][] toRaw() {
        int[][] raw = new int[rows][cols];
        for (int row = 0; row < rows; row++) {
            int base = row * cols;
            for (int col = 0; col < cols; col++) {
                raw[row][col] = TYPES[cells[base + col]].marker();
            }
        }
        return raw;
    }
}
