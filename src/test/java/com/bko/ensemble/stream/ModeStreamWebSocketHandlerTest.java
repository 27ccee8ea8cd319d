package com.bko.ensemble.stream;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ModeStreamWebSocketHandlerTest {

    @Test
    void testParseSince() {
        assertEquals(0L, ModeStreamWebSocketHandler.parseSince(null));
        assertEquals(0L, ModeStreamWebSocketHandler.parseSince("  "));
        assertEquals(0L, ModeStreamWebSocketHandler.parseSince("abc"));
        assertEquals(42L, ModeStreamWebSocketHandler.parseSince(" 42 "));
    }
}
