package org.meetingpoint.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Main Tests")
class MainTest {

    @Test
    @DisplayName("Runs default to five")
    void testDefaultRuns() {
        assertEquals(5, Main.parseRuns(new String[0]));
        assertEquals(5, Main.parseRuns(null));
    }

    @Test
    @DisplayName("Runs are read from the first argument")
    void testExplicitRuns() {
        assertEquals(12, Main.parseRuns(new String[]{" 12 "}));
    }

    @Test
    @DisplayName("Invalid runs are rejected")
    void testInvalidRuns() {
        assertThrows(IllegalArgumentException.class, () -> Main.parseRuns(new String[]{"abc"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseRuns(new String[]{"0"}));
    }
}
