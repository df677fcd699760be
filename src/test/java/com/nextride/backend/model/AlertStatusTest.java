package com.nextride.backend.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AlertStatusTest {

    private static final Instant NOW = Instant.parse("2024-05-01T14:00:00Z");

    @Test
    void testClassify() {
        assertEquals(AlertStatus.UPCOMING, AlertStatus.classify(NOW.plusSeconds(60), null, NOW));
        assertEquals(AlertStatus.PAST, AlertStatus.classify(NOW.minusSeconds(3600), NOW.minusSeconds(60), NOW));
        assertEquals(AlertStatus.ACTIVE, AlertStatus.classify(NOW.minusSeconds(60), NOW.plusSeconds(60), NOW));
    }

    @Test
    void testClassify_OpenEndedPeriods() {
        assertEquals(AlertStatus.ACTIVE, AlertStatus.classify(null, null, NOW));
        assertEquals(AlertStatus.ACTIVE, AlertStatus.classify(NOW.minusSeconds(60), null, NOW));
        assertEquals(AlertStatus.ACTIVE, AlertStatus.classify(null, NOW.plusSeconds(60), NOW));
    }

    @Test
    void testClassify_BoundariesAreActive() {
        assertEquals(AlertStatus.ACTIVE, AlertStatus.classify(NOW, NOW.plusSeconds(60), NOW));
        assertEquals(AlertStatus.ACTIVE, AlertStatus.classify(NOW.minusSeconds(60), NOW, NOW));
    }
}
