package org.meetingpoint.bench;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one benchmark scenario.
 *
 * <p>{@code separable} and {@code traversal} are only measured for obstacle-free grids
 * with houses and are {@code null} otherwise.</p>
 */
@Value
@Builder
public class BenchmarkResult {
    BenchmarkScenario scenario;
    int houses;
    int obstacles;
    int empty;
    BenchmarkSample main;
    BenchmarkSample separable;
    BenchmarkSample traversal;

    public boolean hasCrossCheck() {
        return separable != null && traversal != null;
    }

    /**
     * Returns whether scan and traversal agreed, or true when no cross-check ran.
     */
    public boolean resultsMatch() {
        return !hasCrossCheck() || separable.getResult() == traversal.getResult();
    }

    /**
     * Returns traversal time divided by scan time, or NaN when unavailable.
     */
    public double speedup() {
        if (!hasCrossCheck() || separable.getMeanNanos() <= 0.0d) {
            return Double.NaN;
        }
        return traversal.getMeanNanos() / separable.getMeanNanos();
    }
}
