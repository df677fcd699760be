package com.nextride.backend.model;

/**
 * Direction of travel, encoded as a suffix on a station's base stop id.
 */
public enum Direction {

    NORTHBOUND("N"),
    SOUTHBOUND("S");

    private final String suffix;

    Direction(String suffix) {
        this.suffix = suffix;
    }

    public String platformId(String stationId) {
        return stationId + suffix;
    }

    /**
     * Accepts the suffix ("N") or the name ("northbound"), case-insensitively.
     */
    public static Direction parse(String value) {
        if (value != null) {
            String v = value.trim();
            for (Direction d : values()) {
                if (d.suffix.equalsIgnoreCase(v) || d.name().equalsIgnoreCase(v)) {
                    return d;
                }
            }
        }
        throw new IllegalArgumentException("Unknown direction: " + value);
    }
}
