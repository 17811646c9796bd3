package org.meetingpoint.bench;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters for one randomized benchmark grid.
 */
@Value
@Builder(toBuilder = true)
public class GridGeneratorConfig {
    int rows;
    int cols;

    /**
     * Fraction of all cells that become houses, in [0, 1].
     */
    double houseDensity;

    /**
     * Fraction of the cells left empty after house placement that become obstacles, in [0, 1].
     */
    @Builder.Default
    double obstacleDensity = 0.0d;

    /**
     * Deterministic seed for cell selection.
     */
    @Builder.Default
    long seed = 42L;
}
