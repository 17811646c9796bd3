package org.meetingpoint.bench;

import lombok.Value;

import java.util.List;

/**
 * Aggregate figures over a scaling run.
 */
@Value
public class ScalingSummary {
    /** Mean of the speedups above 1, or NaN when no size showed one. */
    double averageSpeedup;
    /** Number of sizes whose speedup exceeded 1. */
    int speedupCount;
    /** Result with the most cells. */
    ScalingResult largest;

    /**
     * Summarizes a non-empty scaling run.
     *
     * @throws IllegalArgumentException when {@code results} is empty.
     */
    public static ScalingSummary of(List<ScalingResult> results) {
        if (results.isEmpty()) {
            throw new IllegalArgumentException("results must be non-empty");
        }
        double total = 0.0d;
        int count = 0;
        ScalingResult largest = results.get(0);
        for (ScalingResult result : results) {
            double speedup = result.speedup();
            if (speedup > 1.0d) {
                total += speedup;
                count++;
            }
            if (result.cells() > largest.cells()) {
                largest = result;
            }
        }
        return new ScalingSummary(count == 0 ? Double.NaN : total / count, count, largest);
    }

    public boolean hasSpeedup() {
        return speedupCount > 0;
    }
}
