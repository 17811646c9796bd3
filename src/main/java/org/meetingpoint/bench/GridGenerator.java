package org.meetingpoint.bench;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.meetingpoint.grid.CellType;

import java.util.Random;

/**
 * Seeded producer of randomized raw grids for benchmarks and randomized tests.
 *
 * <p>Houses are placed first on {@code floor(rows * cols * houseDensity)} distinct cells;
 * obstacles then take {@code floor(remainingEmpty * obstacleDensity)} distinct cells among
 * the cells still empty. Equal configs produce equal grids.</p>
 */
@UtilityClass
public final class GridGenerator {

    /**
     * Generates one raw grid.
     *
     * @param config generation parameters.
     * @return raw grid using {@code 0} empty, {@code 1} house, {@code 2} obstacle.
     * @throws IllegalArgumentException when dimensions are negative or densities fall outside [0, 1].
     */
    public static int[][] generate(GridGeneratorConfig config) {
        int rows = config.getRows();
        int cols = config.getCols();
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("rows and cols must be non-negative, got " + rows + "x" + cols);
        }
        ensureDensity("houseDensity", config.getHouseDensity());
        ensureDensity("obstacleDensity", config.getObstacleDensity());

        int[][] grid = new int[rows][cols];
        int totalCells = Math.multiplyExact(rows, cols);
        Random random = new Random(config.getSeed());

        IntArrayList available = new IntArrayList(totalCells);
        for (int cellId = 0; cellId < totalCells; cellId++) {
            available.add(cellId);
        }

        int houseCount = (int) (totalCells * config.getHouseDensity());
        place(grid, cols, available, houseCount, CellType.HOUSE_MARKER, random);

        int obstacleCount = (int) (available.size() * config.getObstacleDensity());
        place(grid, cols, available, obstacleCount, CellType.OBSTACLE_MARKER, random);
        return grid;
    }

    /**
     * Moves {@code count} random cells out of {@code available} and writes {@code marker} to them.
     */
    private static void place(int[][] grid, int cols, IntArrayList available, int count, int marker, Random random) {
        for (int placed = 0; placed < count; placed++) {
            int pick = random.nextInt(available.size());
            int last = available.size() - 1;
            int cellId = available.getInt(pick);
            available.set(pick, available.getInt(last));
            available.removeInt(last);
            grid[cellId / cols][cellId % cols] = marker;
        }
    }

    private static void ensureDensity(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
        }
    }
}
