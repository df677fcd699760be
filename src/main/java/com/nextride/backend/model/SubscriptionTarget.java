package com.nextride.backend.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a subscription points at: exactly one stop or exactly one route.
 * Instances are only created through {@link #stop(String)} and
 * {@link #route(String)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubscriptionTarget {

    public enum Type {
        STOP, ROUTE
    }

    Type type;
    String id;

    public static SubscriptionTarget stop(String stopId) {
        return new SubscriptionTarget(Type.STOP, requireId(stopId, "stop"));
    }

    public static SubscriptionTarget route(String routeId) {
        return new SubscriptionTarget(Type.ROUTE, requireId(routeId, "route"));
    }

    /**
     * Rebuilds a target from the two nullable storage columns.
     *
     * @throws IllegalStateException when both or neither column is set
     */
    public static SubscriptionTarget fromColumns(String stopId, String routeId) {
        if (stopId != null && routeId == null) {
            return stop(stopId);
        }
        if (routeId != null && stopId == null) {
            return route(routeId);
        }
        throw new IllegalStateException(
                "Subscription must target exactly one of stop or route (stop=" + stopId + ", route=" + routeId + ")");
    }

    public String getStopId() {
        return type == Type.STOP ? id : null;
    }

    public String getRouteId() {
        return type == Type.ROUTE ? id : null;
    }

    private static String requireId(String id, String kind) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("A " + kind + " subscription needs a non-blank id");
        }
        return id.trim();
    }
}
