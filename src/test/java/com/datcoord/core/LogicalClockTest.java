package com.datcoord.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LogicalClockTest {

    @Test
    void shouldTickMonotonicallyAndNeverMoveBack() {
        LogicalClock clock = new LogicalClock(5);

        assertEquals(6, clock.tick());
        clock.advanceTo(3);
        assertEquals(6, clock.current());
        clock.advanceTo(40);
        assertEquals(41, clock.tick());
    }

    @Test
    void shouldRejectNegativeStart() {
        assertThrows(IllegalArgumentException.class, () -> new LogicalClock(-1));
    }
}
