package org.meetingpoint.bench;

import org.meetingpoint.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs benchmark scenarios and reports timings and scan/traversal agreement.
 *
 * <p>Two tables are available: {@link #standardScenarios()} for mixed densities and
 * {@link #scalingScenarios()} for growing grid sizes, each size measured on an
 * obstacle-free grid and on a paired grid with obstacles.</p>
 */
public final class BenchmarkSuite {
    private static final Logger log = LoggerFactory.getLogger(BenchmarkSuite.class);

    public static final double SCALING_OBSTACLE_DENSITY = 0.05d;

    private final BenchmarkHarness harness;
    private final int runs;

    /**
     * @param harness measurement harness.
     * @param runs timed invocations per measurement, at least 1.
     */
    public BenchmarkSuite(BenchmarkHarness harness, int runs) {
        this.harness = Objects.requireNonNull(harness, "harness");
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be >= 1, got " + runs);
        }
        this.runs = runs;
    }

    /**
     * Returns the standard scenario table, from small dense grids to large grids with obstacles.
     */
    public static List<BenchmarkScenario> standardScenarios() {
        return List.of(
                scenario("Small Dense", 20, 0.2d, 0.0d),
                scenario("Small Sparse", 20, 0.05d, 0.0d),
                scenario("Medium Dense", 50, 0.1d, 0.0d),
                scenario("Medium with Obstacles", 50, 0.1d, 0.1d),
                scenario("Large Sparse", 100, 0.02d, 0.0d),
                scenario("Large with Obstacles", 100, 0.05d, 0.05d)
        );
    }

    /**
     * Returns the scaling table from 10x10 to 120x120. The obstacle density applies to the
     * paired grid only.
     */
    public static List<BenchmarkScenario> scalingScenarios() {
        return List.of(
                scenario("Tiny", 10, 0.15d, SCALING_OBSTACLE_DENSITY),
                scenario("Small", 25, 0.1d, SCALING_OBSTACLE_DENSITY),
                scenario("Medium", 50, 0.08d, SCALING_OBSTACLE_DENSITY),
                scenario("Large", 75, 0.06d, SCALING_OBSTACLE_DENSITY),
                scenario("XLarge", 100, 0.04d, SCALING_OBSTACLE_DENSITY),
                scenario("XXLarge", 120, 0.03d, SCALING_OBSTACLE_DENSITY)
        );
    }

    private static BenchmarkScenario scenario(String name, int side, double houseDensity, double obstacleDensity) {
        return BenchmarkScenario.builder()
                .name(name)
                .rows(side)
                .cols(side)
                .houseDensity(houseDensity)
                .obstacleDensity(obstacleDensity)
                .build();
    }

    /**
     * Runs every scenario in order and logs a summary table.
     *
     * @param scenarios scenarios to run.
     * @return one result per scenario, in input order.
     */
    public List<BenchmarkResult> run(List<BenchmarkScenario> scenarios) {
        List<BenchmarkResult> results = new ArrayList<>(scenarios.size());
        for (BenchmarkScenario scenario : scenarios) {
            results.add(run(scenario));
        }
        logSummary(results);
        return results;
    }

    /**
     * Runs one scenario.
     */
    public BenchmarkResult run(BenchmarkScenario scenario) {
        log.info("Testing: {} ({})", scenario.getName(), scenario.size());
        int[][] raw = GridGenerator.generate(scenario.toGeneratorConfig());
        Grid grid = Grid.of(raw);
        int houses = grid.houses().size();
        int obstacles = grid.obstacleCount();
        log.info(
                "Grid composition: {} houses, {} obstacles, {} empty",
                houses, obstacles, grid.emptyCount()
        );

        BenchmarkSample main = harness.measure(BenchmarkTarget.MAIN, raw, runs);
        if (log.isInfoEnabled()) {
            log.info("Main algorithm: {} (result: {})", formatTiming(main), main.getResult());
        }

        BenchmarkResult.BenchmarkResultBuilder builder = BenchmarkResult.builder()
                .scenario(scenario)
                .houses(houses)
                .obstacles(obstacles)
                .empty(grid.emptyCount())
                .main(main);

        if (obstacles == 0 && houses > 0) {
            BenchmarkSample separable = harness.measure(BenchmarkTarget.SEPARABLE, raw, runs);
            BenchmarkSample traversal = harness.measure(BenchmarkTarget.TRAVERSAL, raw, runs);
            builder.separable(separable).traversal(traversal);
            if (log.isInfoEnabled()) {
                log.info("Separable scan: {} (result: {})", formatTiming(separable), separable.getResult());
                log.info("Traversal:      {} (result: {})", formatTiming(traversal), traversal.getResult());
            }
        }

        BenchmarkResult result = builder.build();
        if (result.hasCrossCheck()) {
            if (result.resultsMatch()) {
                if (log.isInfoEnabled()) {
                    log.info("Scan and traversal results match, scan speedup {}x", String.format("%.2f", result.speedup()));
                }
            } else {
                log.warn(
                        "Scan and traversal results differ for {}: {} vs {}",
                        scenario.getName(), result.getSeparable().getResult(), result.getTraversal().getResult()
                );
            }
        }
        return result;
    }

    /**
     * Runs every scaling scenario in order.
     *
     * @param scenarios scenarios whose obstacle density is used for the paired grid.
     * @return one result per scenario, in input order.
     */
    public List<ScalingResult> runScaling(List<BenchmarkScenario> scenarios) {
        List<ScalingResult> results = new ArrayList<>(scenarios.size());
        for (BenchmarkScenario scenario : scenarios) {
            results.add(runScaling(scenario));
        }
        return results;
    }

    /**
     * Measures one grid size: dispatcher, scan and traversal on the obstacle-free grid, then
     * the dispatcher on the paired grid with obstacles.
     */
    public ScalingResult runScaling(BenchmarkScenario scenario) {
        log.info("Benchmarking: {} ({})", scenario.getName(), scenario.size());
        GridGeneratorConfig withObstacles = scenario.toGeneratorConfig();
        int[][] clear = GridGenerator.generate(withObstacles.toBuilder().obstacleDensity(0.0d).build());
        int[][] blocked = GridGenerator.generate(withObstacles);

        ScalingResult result = ScalingResult.builder()
                .scenario(scenario)
                .main(harness.measure(BenchmarkTarget.MAIN, clear, runs))
                .separable(harness.measure(BenchmarkTarget.SEPARABLE, clear, runs))
                .traversal(harness.measure(BenchmarkTarget.TRAVERSAL, clear, runs))
                .mainWithObstacles(harness.measure(BenchmarkTarget.MAIN, blocked, runs))
                .build();

        if (log.isInfoEnabled()) {
            log.info("  Main (no obstacles):   {}", formatTiming(result.getMain()));
            log.info("  Separable scan:        {}", formatTiming(result.getSeparable()));
            log.info("  Traversal:             {}", formatTiming(result.getTraversal()));
            log.info("  Main (with obstacles): {}", formatTiming(result.getMainWithObstacles()));
        }
        if (result.resultsAgree()) {
            log.info("  All algorithms agree on result {}", result.getMain().getResult());
        } else {
            log.warn(
                    "  Results differ for {}: main {}, scan {}, traversal {}",
                    scenario.getName(),
                    result.getMain().getResult(),
                    result.getSeparable().getResult(),
                    result.getTraversal().getResult()
            );
        }
        return result;
    }

    /**
     * Logs the per-size speedup table, the average scan speedup and the largest grid.
     *
     * @param results non-empty scaling results.
     * @return aggregate figures of the run.
     */
    public static ScalingSummary summarizeScaling(List<ScalingResult> results) {
        ScalingSummary summary = ScalingSummary.of(results);
        if (!log.isInfoEnabled()) {
            return summary;
        }

        log.info(String.format("%-10s %-8s %-12s %-12s %-12s %-8s", "Grid", "Size", "Main", "Scan", "Traversal", "Speedup"));
        for (ScalingResult result : results) {
            log.info(String.format(
                    "%-10s %-8d %-12s %-12s %-12s %.2fx",
                    result.getScenario().getName(),
                    result.cells(),
                    String.format("%.4fs", result.getMain().meanSeconds()),
                    String.format("%.4fs", result.getSeparable().meanSeconds()),
                    String.format("%.4fs", result.getTraversal().meanSeconds()),
                    result.speedup()
            ));
        }
        if (summary.hasSpeedup()) {
            log.info("Average scan speedup: {}x", String.format("%.2f", summary.getAverageSpeedup()));
        }
        ScalingResult largest = summary.getLargest();
        log.info(
                "Largest grid tested: {} ({} cells) in {}s",
                largest.getScenario().size(),
                largest.cells(),
                String.format("%.4f", largest.getMain().meanSeconds())
        );
        return summary;
    }

    private static void logSummary(List<BenchmarkResult> results) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info(String.format("%-22s %-10s %-8s %-16s %-8s", "Test Case", "Size", "Houses", "Time (s)", "Result"));
        for (BenchmarkResult result : results) {
            BenchmarkSample main = result.getMain();
            log.info(String.format(
                    "%-22s %-10s %-8d %-16s %-8d",
                    result.getScenario().getName(),
                    result.getScenario().size(),
                    result.getHouses(),
                    String.format("%.4f±%.3f", main.meanSeconds(), main.stdSeconds()),
                    main.getResult()
            ));
        }
    }

    private static String formatTiming(BenchmarkSample sample) {
        return String.format("%.4fs ± %.4fs", sample.meanSeconds(), sample.stdSeconds());
    }
}
