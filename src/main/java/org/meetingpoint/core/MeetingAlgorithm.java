package org.meetingpoint.core;

/**
 * Meeting-point algorithm selector used by the dispatcher.
 *
 * <p>{@code SEPARABLE_SCAN} is valid only for obstacle-free grids.
 * {@code REACHABILITY_TRAVERSAL} is valid for every grid.</p>
 */
public enum MeetingAlgorithm {
    SEPARABLE_SCAN,
    REACHABILITY_TRAVERSAL
}
