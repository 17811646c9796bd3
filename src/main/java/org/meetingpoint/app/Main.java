package org.meetingpoint.app;

import org.meetingpoint.bench.BenchmarkHarness;
import org.meetingpoint.bench.BenchmarkResult;
import org.meetingpoint.bench.BenchmarkSuite;
import org.meetingpoint.bench.ScalingResult;
import org.meetingpoint.core.MeetingPointCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Command-line entry point that runs the standard and scaling benchmark tables.
 *
 * <p>Usage: {@code Main [runs]}, where {@code runs} is the number of timed invocations
 * per measurement of the standard table (default 5). The scaling table always uses
 * {@value #SCALING_RUNS} runs.</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final int DEFAULT_RUNS = 5;
    static final int SCALING_RUNS = 10;

    /**
     * Runs the benchmark suite.
     *
     * @param args optional runs per measurement.
     */
    public static void main(String[] args) {
        int runs = parseRuns(args);
        log.info("=== Optimal Meeting Point Benchmarks ({} runs per measurement) ===", runs);

        BenchmarkHarness harness = new BenchmarkHarness(new MeetingPointCore());
        List<BenchmarkResult> results = new BenchmarkSuite(harness, runs).run(BenchmarkSuite.standardScenarios());

        log.info("=== Scaling Benchmarks ({} runs per measurement) ===", SCALING_RUNS);
        List<ScalingResult> scaling = new BenchmarkSuite(harness, SCALING_RUNS).runScaling(BenchmarkSuite.scalingScenarios());
        BenchmarkSuite.summarizeScaling(scaling);

        long mismatches = results.stream().filter(result -> !result.resultsMatch()).count()
                + scaling.stream().filter(result -> !result.resultsAgree()).count();
        if (mismatches > 0) {
            log.error("{} scenario(s) had diverging scan and traversal results", mismatches);
            System.exit(1);
        }
    }

    static int parseRuns(String[] args) {
        if (args == null || args.length == 0) {
            return DEFAULT_RUNS;
        }
        int runs;
        try {
            runs = Integer.parseInt(args[0].trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("runs must be an integer, got '" + args[0] + "'", ex);
        }
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be >= 1, got " + runs);
        }
        return runs;
    }
}
