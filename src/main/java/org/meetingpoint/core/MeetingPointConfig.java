package org.meetingpoint.core;

import lombok.Builder;
import lombok.Value;

/**
 * Dispatcher configuration bound once when the service is built.
 */
@Value
@Builder
public class MeetingPointConfig {

    /**
     * Forced algorithm, or {@code null} to select by obstacle presence.
     */
    MeetingAlgorithm algorithmOverride;

    /**
     * Returns the default config: obstacle-free grids use the separable scan,
     * everything else the reachability traversal.
     */
    public static MeetingPointConfig automatic() {
        return MeetingPointConfig.builder().build();
    }

    /**
     * Returns a config that always runs the given algorithm.
     */
    public static MeetingPointConfig forced(MeetingAlgorithm algorithm) {
        return MeetingPointConfig.builder()
                .algorithmOverride(algorithm)
                .build();
    }
}
