package org.meetingpoint.core;

import lombok.Builder;
import org.meetingpoint.grid.Grid;
import org.meetingpoint.grid.HouseSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main meeting-point entry point.
 *
 * <p>The dispatcher classifies the grid once and delegates to exactly one algorithm:</p>
 * <ul>
 * <li>No cells or no houses: the sentinel {@link #NO_MEETING_POINT}, without running any algorithm.</li>
 * <li>No obstacles: {@link MeetingAlgorithm#SEPARABLE_SCAN}.</li>
 * <li>Obstacles present: {@link MeetingAlgorithm#REACHABILITY_TRAVERSAL}.</li>
 * </ul>
 * <p>The dispatcher never computes distances itself. Instances hold no per-call state and
 * may be shared between threads; every call allocates its own working buffers.</p>
 */
public final class MeetingPointCore implements MeetingPointService {
    public static final long NO_MEETING_POINT = -1L;

    public static final String REASON_SEPARABLE_SCAN_OBSTACLES_PRESENT = "MP_SEPARABLE_SCAN_OBSTACLES_PRESENT";

    private static final Logger log = LoggerFactory.getLogger(MeetingPointCore.class);

    private final MeetingPointConfig config;
    private final SeparableDistanceScanner separableScanner = new SeparableDistanceScanner();
    private final ReachabilityTraversal reachabilityTraversal = new ReachabilityTraversal();

    /**
     * Creates the dispatcher.
     *
     * @param config dispatcher configuration (automatic selection when null).
     */
    @Builder
    public MeetingPointCore(MeetingPointConfig config) {
        this.config = config == null ? MeetingPointConfig.automatic() : config;
    }

    /**
     * Creates a dispatcher with automatic algorithm selection.
     */
    public MeetingPointCore() {
        this(MeetingPointConfig.automatic());
    }

    @Override
    public long solve(int[][] grid) {
        return solve(Grid.of(grid));
    }

    @Override
    public MeetingPointResponse plan(int[][] grid) {
        return plan(Grid.of(grid));
    }

    /**
     * Computes the minimum total distance for an already classified grid.
     *
     * @param grid classified grid.
     * @return minimum total distance, or {@link #NO_MEETING_POINT}.
     */
    public long solve(Grid grid) {
        return plan(grid).getTotalDistance();
    }

    /**
     * Computes the meeting point for an already classified grid.
     *
     * @param grid classified grid.
     * @return response with distance, selected algorithm and traversal counters.
     * @throws MeetingPointException when a forced separable scan meets a grid with obstacles.
     */
    public MeetingPointResponse plan(Grid grid) {
        MeetingPointResponse.MeetingPointResponseBuilder builder = MeetingPointResponse.builder()
                .rows(grid.rows())
                .cols(grid.cols())
                .obstacleCount(grid.obstacleCount());

        if (grid.isEmpty()) {
            log.debug("grid {}x{} has no cells, no meeting point", grid.rows(), grid.cols());
            return builder.found(false).totalDistance(NO_MEETING_POINT).build();
        }
        HouseSet houses = grid.houses();
        if (houses.isEmpty()) {
            log.debug("grid {}x{} has no houses, no meeting point", grid.rows(), grid.cols());
            return builder.found(false).totalDistance(NO_MEETING_POINT).build();
        }

        MeetingAlgorithm algorithm = selectAlgorithm(grid);
        log.debug(
                "grid {}x{} with {} houses and {} obstacles routed to {}",
                grid.rows(), grid.cols(), houses.size(), grid.obstacleCount(), algorithm
        );
        MeetingPlan plan = switch (algorithm) {
            case SEPARABLE_SCAN -> separableScanner.compute(grid, houses);
            case REACHABILITY_TRAVERSAL -> reachabilityTraversal.compute(grid, houses);
        };

        return builder
                .found(plan.found())
                .totalDistance(plan.totalDistance())
                .algorithm(algorithm)
                .houseCount(houses.size())
                .visitedCells(plan.visitedCells())
                .frontierPeak(plan.frontierPeak())
                .build();
    }

    /**
     * Runs the separable scan directly.
     *
     * <p>The grid must be obstacle-free; this is not re-validated. With an empty house
     * list every empty cell costs {@code 0}.</p>
     *
     * @param grid obstacle-free grid.
     * @param houses house list of {@code grid}.
     * @return minimum total distance, or {@link #NO_MEETING_POINT} when there is no empty cell.
     */
    public long scanNoObstacles(Grid grid, HouseSet houses) {
        if (grid.isEmpty()) {
            return NO_MEETING_POINT;
        }
        return separableScanner.compute(grid, houses).totalDistance();
    }

    /**
     * Runs the reachability traversal directly.
     *
     * @param grid grid, with or without obstacles.
     * @param houses house list of {@code grid}.
     * @return minimum total distance, or {@link #NO_MEETING_POINT} when no empty cell is reachable from every house.
     */
    public long traverseWithObstacles(Grid grid, HouseSet houses) {
        if (grid.isEmpty()) {
            return NO_MEETING_POINT;
        }
        return reachabilityTraversal.compute(grid, houses).totalDistance();
    }

    /**
     * Chooses the algorithm for a non-empty grid with houses.
     */
    MeetingAlgorithm selectAlgorithm(Grid grid) {
        MeetingAlgorithm forced = config.getAlgorithmOverride();
        if (forced == null) {
            return grid.hasObstacles() ? MeetingAlgorithm.REACHABILITY_TRAVERSAL : MeetingAlgorithm.SEPARABLE_SCAN;
        }
        if (forced == MeetingAlgorithm.SEPARABLE_SCAN && grid.hasObstacles()) {
            throw new MeetingPointException(
                    REASON_SEPARABLE_SCAN_OBSTACLES_PRESENT,
                    "separable scan forced on a grid with " + grid.obstacleCount() + " obstacles"
            );
        }
        return forced;
    }

    MeetingPointConfig config() {
        return config;
    }
}
