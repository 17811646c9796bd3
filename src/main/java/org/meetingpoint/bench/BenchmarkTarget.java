package org.meetingpoint.bench;

/**
 * Entry point a benchmark measurement invokes.
 */
public enum BenchmarkTarget {
    /** Full dispatcher, including classification and algorithm selection. */
    MAIN,
    /** Separable scan on a precomputed house list. */
    SEPARABLE,
    /** Reachability traversal on a precomputed house list. */
    TRAVERSAL
}
