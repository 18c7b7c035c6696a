package org.carma.fleetalloc.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RevenueContextTest {

    @Test
    void advance_withinDayKeepsDay() {
        var next = new RevenueContext(2, 10.0, "clear").advance(0.5);

        assertEquals(2, next.day());
        assertEquals(10.5, next.time(), 1e-9);
    }

    @Test
    void advance_reachingMidnightRollsDay() {
        var next = new RevenueContext(3, 23.5, "clear").advance(0.5);

        assertEquals(4, next.day());
        assertEquals(0.0, next.time(), 1e-9);
    }

    @Test
    void advance_passingMidnightOffGridRollsDay() {
        var next = new RevenueContext(2, 23.7, "clear").advance(0.5);

        assertEquals(3, next.day());
        assertEquals(0.2, next.time(), 1e-9);
    }

    @Test
    void advance_sundayWrapsToMonday() {
        var next = new RevenueContext(6, 23.75, "rain").advance(0.5);

        assertEquals(0, next.day());
        assertEquals("rain", next.weather());
    }

    @Test
    void constructor_normalizesFields() {
        var context = new RevenueContext(8, -1.0, "  Rain ");

        assertEquals(1, context.day());
        assertEquals(23.0, context.time(), 1e-9);
        assertEquals("rain", context.weather());
        assertEquals("clear", new RevenueContext(0, 0.0, null).weather());
    }

    @Test
    void circularDistance_wrapsAroundMidnight() {
        assertEquals(1.0, RevenueContext.circularDistance(23.5, 0.5), 1e-9);
        assertEquals(12.0, RevenueContext.circularDistance(0.0, 12.0), 1e-9);
        assertEquals(3.0, RevenueContext.circularDistance(8.0, 5.0), 1e-9);
    }
}
