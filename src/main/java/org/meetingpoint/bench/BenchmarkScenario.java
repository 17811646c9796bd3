package org.meetingpoint.bench;

import lombok.Builder;
import lombok.Value;

/**
 * Named grid shape measured by the benchmark suite.
 */
@Value
@Builder
public class BenchmarkScenario {
    String name;
    int rows;
    int cols;
    double houseDensity;
    @Builder.Default
    double obstacleDensity = 0.0d;
    @Builder.Default
    long seed = 42L;

    /**
     * Returns the generator parameters for this scenario.
     */
    public GridGeneratorConfig toGeneratorConfig() {
        return GridGeneratorConfig.builder()
                .rows(rows)
                .cols(cols)
                .houseDensity(houseDensity)
                .obstacleDensity(obstacleDensity)
                .seed(seed)
                .build();
    }

    public String size() {
        return rows + "x" + cols;
    }
}
