package org.meetingpoint.search;

/**
 * Visited-cell tracking that is reset logically by advancing a generation counter.
 * <p>
 * Each cell carries the generation number of the traversal that last visited it. A cell
 * counts as visited iff its tag equals the current generation, so starting a new traversal
 * costs one increment instead of clearing {@code capacity} entries.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is intended
 * for use within a single traversal context.
 * </p>
 */
public class GenerationVisitedSet {

    private final int[] tags;
    private int generation = 1;

    /**
     * Constructs a new GenerationVisitedSet with every cell unvisited.
     *
     * @param capacity number of addressable cells.
     */
    public GenerationVisitedSet(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative");
        }
        this.tags = new int[capacity];
    }

    /**
     * Marks a cell as visited in the current generation if it hasn't been visited already.
     *
     * @param cellId packed cell id.
     * @return {@code true} if the cell was successfully marked (was NOT previously visited).
     * {@code false} if the cell was already visited in this generation.
     */
    public boolean markVisited(int cellId) {
        if (tags[cellId] == generation) {
            return false;
        }
        tags[cellId] = generation;
        return true;
    }

    /**
     * Starts a new generation, marking every cell unvisited.
     *
     * @return the new generation number.
     * @throws IllegalStateException if the generation counter would wrap.
     */
    public int advanceGeneration() {
        if (generation == Integer.MAX_VALUE) {
            throw new IllegalStateException("generation counter exhausted");
        }
        generation++;
        return generation;
    }
}
