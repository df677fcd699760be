package com.nextride.backend.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionTargetTest {

    @Test
    void testFactories() {
        SubscriptionTarget stop = SubscriptionTarget.stop("127");
        assertEquals(SubscriptionTarget.Type.STOP, stop.getType());
        assertEquals("127", stop.getStopId());
        assertNull(stop.getRouteId());

        SubscriptionTarget route = SubscriptionTarget.route(" A ");
        assertEquals("A", route.getRouteId());
        assertNull(route.getStopId());
    }

    @Test
    void testFactories_RejectBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> SubscriptionTarget.stop(" "));
        assertThrows(IllegalArgumentException.class, () -> SubscriptionTarget.route(null));
    }

    @Test
    void testFromColumns_ExactlyOneTarget() {
        assertEquals(SubscriptionTarget.stop("127"), SubscriptionTarget.fromColumns("127", null));
        assertEquals(SubscriptionTarget.route("A"), SubscriptionTarget.fromColumns(null, "A"));
        assertThrows(IllegalStateException.class, () -> SubscriptionTarget.fromColumns("127", "A"));
        assertThrows(IllegalStateException.class, () -> SubscriptionTarget.fromColumns(null, null));
    }
}
