package com.flowmable.optimizer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HueRangeTest {

    @Test
    void contains_isInclusive() {
        HueRange range = new HueRange(20.0, 25.0);

        assertTrue(range.contains(20.0));
        assertTrue(range.contains(25.0));
        assertFalse(range.contains(25.01));
        assertFalse(range.contains(19.99));
    }

    @Test
    void widen_staysWithinHueCircle() {
        assertEquals(new HueRange(15.0, 30.0), new HueRange(20.0, 25.0).widen(5.0));
        assertEquals(new HueRange(0.0, 7.0), new HueRange(2.0, 2.0).widen(5.0));
        assertEquals(new HueRange(350.0, 360.0), new HueRange(355.0, 358.0).widen(5.0));
    }

    @Test
    void invalidRangesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HueRange(30.0, 20.0));
        assertThrows(IllegalArgumentException.class, () -> new HueRange(Double.NaN, 20.0));
    }
}
