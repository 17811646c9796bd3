package org.meetingpoint.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TraversalContext Tests")
class TraversalContextTest {

    @Test
    @DisplayName("beginHouse makes previously offered cells offerable again")
    void testBeginHouseResetsVisited() {
        TraversalContext context = new TraversalContext(4);
        context.beginHouse();
        assertTrue(context.offer(1, 0));
        assertFalse(context.offer(1, 3));
        assertEquals(0, context.depth(1));

        context.beginHouse();
        assertFalse(context.hasFrontier());
        assertTrue(context.offer(1, 2));
        assertEquals(2, context.depth(1));
    }

    @Test
    @DisplayName("Accumulators persist across houses while counters track visits and frontier peak")
    void testAccumulatorsPersist() {
        TraversalContext context = new TraversalContext(3);
        context.beginHouse();
        context.offer(0, 0);
        context.offer(1, 1);
        context.offer(2, 1);
        while (context.hasFrontier()) {
            int cellId = context.poll();
            context.accumulate(cellId, context.depth(cellId));
        }

        context.beginHouse();
        context.offer(2, 0);
        context.accumulate(context.poll(), 0);

        assertEquals(1L, context.distanceSum(1));
        assertEquals(1, context.reachCount(1));
        assertEquals(1L, context.distanceSum(2));
        assertEquals(2, context.reachCount(2));
        assertEquals(4L, context.visitedCells());
        assertEquals(3, context.frontierPeak());
    }
}
