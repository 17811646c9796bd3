package org.meetingpoint.bench;

import lombok.Builder;
import lombok.Value;

/**
 * Timings of one grid size in the scaling run.
 *
 * <p>{@code main}, {@code separable} and {@code traversal} are measured on the obstacle-free
 * grid; {@code mainWithObstacles} on the paired grid generated with the scenario's obstacle density.</p>
 */
@Value
@Builder
public class ScalingResult {
    BenchmarkScenario scenario;
    BenchmarkSample main;
    BenchmarkSample separable;
    BenchmarkSample traversal;
    BenchmarkSample mainWithObstacles;

    public int cells() {
        return scenario.getRows() * scenario.getCols();
    }

    /**
     * Returns whether dispatcher, scan and traversal agree on the obstacle-free grid.
     */
    public boolean resultsAgree() {
        return main.getResult() == separable.getResult() && separable.getResult() == traversal.getResult();
    }

    /**
     * Returns traversal time divided by scan time, or {@code 1.0} when the scan time is not positive.
     */
    public double speedup() {
        if (separable.getMeanNanos() <= 0.0d) {
            return 1.0d;
        }
        return traversal.getMeanNanos() / separable.getMeanNanos();
    }
}
