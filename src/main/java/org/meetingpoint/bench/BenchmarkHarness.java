package org.meetingpoint.bench;

import org.meetingpoint.core.MeetingPointCore;
import org.meetingpoint.grid.Grid;
import org.meetingpoint.grid.HouseSet;

import java.util.Objects;

/**
 * Times repeated meeting-point computations through the public service contract.
 */
public final class BenchmarkHarness {
    private final MeetingPointCore core;

    public BenchmarkHarness(MeetingPointCore core) {
        this.core = Objects.requireNonNull(core, "core");
    }

    /**
     * Invokes {@code target} on {@code grid} {@code runs} times and aggregates the timings.
     *
     * <p>For {@link BenchmarkTarget#SEPARABLE} and {@link BenchmarkTarget#TRAVERSAL} the grid is
     * classified inside the timed region; a grid without houses yields the sentinel.</p>
     *
     * @param target entry point to measure.
     * @param grid raw grid.
     * @param runs number of timed invocations, at least 1.
     * @return aggregated sample.
     */
    public BenchmarkSample measure(BenchmarkTarget target, int[][] grid, int runs) {
        Objects.requireNonNull(target, "target");
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be >= 1, got " + runs);
        }

        long[] elapsed = new long[runs];
        long result = MeetingPointCore.NO_MEETING_POINT;
        for (int i = 0; i < runs; i++) {
            long start = System.nanoTime();
            result = invoke(target, grid);
            elapsed[i] = System.nanoTime() - start;
        }
        double mean = mean(elapsed);
        return new BenchmarkSample(target, runs, mean, sampleStdDev(elapsed, mean), result);
    }

    private long invoke(BenchmarkTarget target, int[][] raw) {
        if (target == BenchmarkTarget.MAIN) {
            return core.solve(raw);
        }
        Grid grid = Grid.of(raw);
        HouseSet houses = grid.houses();
        if (houses.isEmpty()) {
            return MeetingPointCore.NO_MEETING_POINT;
        }
        return switch (target) {
            case SEPARABLE -> core.scanNoObstacles(grid, houses);
            case TRAVERSAL -> core.traverseWithObstacles(grid, houses);
            case MAIN -> core.solve(grid);
        };
    }

    static double mean(long[] values) {
        double sum = 0.0d;
        for (long value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    static double sampleStdDev(long[] values, double mean) {
        if (values.length < 2) {
            return 0.0d;
        }
        double squares = 0.0d;
        for (long value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
