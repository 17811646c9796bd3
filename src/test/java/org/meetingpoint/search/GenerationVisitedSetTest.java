package org.meetingpoint.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("GenerationVisitedSet Tests")
class GenerationVisitedSetTest {

    @Test
    @DisplayName("markVisited succeeds once per generation")
    void testMarkOncePerGeneration() {
        GenerationVisitedSet visited = new GenerationVisitedSet(4);

        assertTrue(visited.markVisited(2));
        assertFalse(visited.markVisited(2));
        assertTrue(visited.markVisited(3));
    }

    @Test
    @DisplayName("advanceGeneration resets visited state logically")
    void testAdvanceResets() {
        GenerationVisitedSet visited = new GenerationVisitedSet(3);
        visited.markVisited(0);
        visited.markVisited(1);

        assertEquals(2, visited.advanceGeneration());

        assertTrue(visited.markVisited(0));
        assertTrue(visited.markVisited(1));
        assertFalse(visited.markVisited(0));
    }

    @Test
    @DisplayName("generation numbers strictly increase")
    void testGenerationStrictlyIncreases() {
        GenerationVisitedSet visited = new GenerationVisitedSet(1);
        int previous = 1;
        for (int i = 0; i < 100; i++) {
            int next = visited.advanceGeneration();
            assertTrue(next > previous);
            previous = next;
        }
        assertEquals(101, previous);
    }

    @Test
    @DisplayName("generation counter refuses to wrap")
    void testGenerationExhaustion() throws ReflectiveOperationException {
        GenerationVisitedSet visited = new GenerationVisitedSet(1);
        Field field = GenerationVisitedSet.class.getDeclaredField("generation");
        field.setAccessible(true);
        field.setInt(visited, Integer.MAX_VALUE);

        assertThrows(IllegalStateException.class, visited::advanceGeneration);
    }

    @Test
    @DisplayName("negative capacity is rejected")
    void testNegativeCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new GenerationVisitedSet(-1));
        GenerationVisitedSet empty = new GenerationVisitedSet(0);
        assertEquals(2, empty.advanceGeneration());
    }
}
