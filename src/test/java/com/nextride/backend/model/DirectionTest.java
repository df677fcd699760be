package com.nextride.backend.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DirectionTest {

    @Test
    void testPlatformId() {
        assertEquals("127N", Direction.NORTHBOUND.platformId("127"));
        assertEquals("127S", Direction.SOUTHBOUND.platformId("127"));
    }

    @Test
    void testParse() {
        assertEquals(Direction.NORTHBOUND, Direction.parse("n"));
        assertEquals(Direction.SOUTHBOUND, Direction.parse("Southbound"));
        assertThrows(IllegalArgumentException.class, () -> Direction.parse("E"));
        assertThrows(IllegalArgumentException.class, () -> Direction.parse(null));
    }
}
