package com.raditha.mvscan.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SinkModeTest {

    @Test
    void testFromString() {
        assertEquals(SinkMode.SAME_VARIABLE, SinkMode.fromString("samevar"));
        assertEquals(SinkMode.VALUE_INFLUENCE, SinkMode.fromString(" Value "));
        assertEquals(SinkMode.NONE, SinkMode.fromString("off"));
        assertEquals(SinkMode.NONE, SinkMode.fromString(""));
        assertEquals(SinkMode.NONE, SinkMode.fromString(null));
    }

    @Test
    void testFromString_Invalid() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SinkMode.fromString("taint"));
        assertTrue(e.getMessage().contains("taint"));
    }

    @Test
    void testCliStringRoundTrip() {
        for (SinkMode mode : SinkMode.values()) {
            assertEquals(mode, SinkMode.fromString(mode.toCliString()));
        }
    }
}
