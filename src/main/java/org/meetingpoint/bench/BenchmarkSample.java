package org.meetingpoint.bench;

import lombok.Value;

/**
 * Aggregated wall-clock samples of one measurement.
 */
@Value
public class BenchmarkSample {
    /** Measured entry point. */
    BenchmarkTarget target;
    /** Number of timed invocations. */
    int runs;
    /** Mean wall-clock time per invocation in nanoseconds. */
    double meanNanos;
    /** Sample standard deviation in nanoseconds ({@code 0} for a single run). */
    double stdNanos;
    /** Result of the last invocation. */
    long result;

    public double meanSeconds() {
        return meanNanos / 1_000_000_000.0d;
    }

    public double stdSeconds() {
        return stdNanos / 1_000_000_000.0d;
    }
}
