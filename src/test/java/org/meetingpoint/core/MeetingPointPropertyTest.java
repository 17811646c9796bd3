package org.meetingpoint.core;

import org.meetingpoint.bench.GridGenerator;
import org.meetingpoint.bench.GridGeneratorConfig;
import org.meetingpoint.grid.CellType;
import org.meetingpoint.grid.Grid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Meeting Point Randomized Property Tests")
class MeetingPointPropertyTest {
    private final MeetingPointCore core = new MeetingPointCore();

    @ParameterizedTest
    @CsvSource({
            "1, 1, 1.0",
            "1, 12, 0.25",
            "7, 5, 0.3",
            "15, 15, 0.1",
            "25, 40, 0.05",
            "30, 30, 0.9"
    })
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Scan and traversal agree on obstacle-free grids")
    void testScanMatchesTraversal(int rows, int cols, double houseDensity) {
        for (long seed = 1; seed <= 25; seed++) {
            Grid grid = Grid.of(GridGenerator.generate(GridGeneratorConfig.builder()
                    .rows(rows)
                    .cols(cols)
                    .houseDensity(houseDensity)
                    .seed(seed)
                    .build()));
            long scanned = core.scanNoObstacles(grid, grid.houses());
            long traversed = core.traverseWithObstacles(grid, grid.houses());
            assertEquals(scanned, traversed, "seed " + seed);
            if (!grid.houses().isEmpty()) {
                assertEquals(MeetingPointTestSupport.directManhattanMinimum(grid), scanned, "seed " + seed);
            }
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Adding obstacles never lowers the minimum total distance")
    void testObstacleMonotonicity() {
        Random random = new Random(2026L);
        for (long seed = 1; seed <= 40; seed++) {
            int[][] raw = GridGenerator.generate(GridGeneratorConfig.builder()
                    .rows(12)
                    .cols(12)
                    .houseDensity(0.08d)
                    .seed(seed)
                    .build());
            long before = core.solve(raw);

            for (int added = 0; added < 10; added++) {
                int row = random.nextInt(12);
                int col = random.nextInt(12);
                if (raw[row][col] == CellType.EMPTY_MARKER) {
                    raw[row][col] = CellType.OBSTACLE_MARKER;
                }
                long after = core.solve(raw);
                if (before == MeetingPointCore.NO_MEETING_POINT) {
                    assertEquals(MeetingPointCore.NO_MEETING_POINT, after, "seed " + seed);
                } else {
                    assertTrue(after == MeetingPointCore.NO_MEETING_POINT || after >= before, "seed " + seed);
                }
                before = after;
            }
        }
    }

    @Test
    @DisplayName("Full enclosure of one house removes every meeting point")
    void testEnclosureRemovesMeetingPoint() {
        int[][] raw = new int[7][7];
        raw[0][0] = 1;
        raw[6][6] = 1;
        assertTrue(core.solve(raw) > 0);

        raw[0][1] = 2;
        raw[1][0] = 2;
        assertEquals(MeetingPointCore.NO_MEETING_POINT, core.solve(raw));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrent calls on a shared grid stay deterministic")
    void testConcurrentDeterminism() throws InterruptedException {
        int[][] raw = GridGenerator.generate(GridGeneratorConfig.builder()
                .rows(30)
                .cols(30)
                .houseDensity(0.05d)
                .obstacleDensity(0.1d)
                .seed(7L)
                .build());
        Grid grid = Grid.of(raw);
        long baseline = core.solve(grid);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch latch = new CountDownLatch(threads);
        AtomicBoolean failed = new AtomicBoolean(false);
        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    for (int i = 0; i < 50; i++) {
                        if (core.solve(grid) != baseline) {
                            failed.set(true);
                            break;
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executor.shutdownNow();
        assertFalse(failed.get(), "concurrent results diverged");
    }
}
