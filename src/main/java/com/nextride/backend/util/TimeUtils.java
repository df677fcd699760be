package com.nextride.backend.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class TimeUtils {

    public static final DateTimeFormatter GTFS_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private TimeUtils() {
    }

    /**
     * Combines a GTFS service date (YYYYMMDD) and time of day (HH:MM:SS) into a
     * local date-time. Hours of 24 and above denote trips that run past
     * midnight on the same service day and roll over to the following day.
     *
     * @return null when either part is missing or blank
     * @throws DateTimeParseException when a part is present but malformed
     */
    public static LocalDateTime parseServiceDateTime(String startDate, String startTime) {
        if (startDate == null || startDate.isEmpty() || startTime == null || startTime.isEmpty()) {
            return null;
        }
        LocalDate date = LocalDate.parse(startDate, GTFS_DATE);

        String[] parts = startTime.split(":");
        if (parts.length != 3) {
            throw new DateTimeParseException("Expected HH:MM:SS", startTime, 0);
        }
        try {
            int hours = Integer.parseInt(parts[0]);
            int minutes = Integer.parseInt(parts[1]);
            int seconds = Integer.parseInt(parts[2]);
            if (hours < 0 || minutes < 0 || minutes > 59 || seconds < 0 || seconds > 59) {
                throw new DateTimeParseException("Time field out of range", startTime, 0);
            }
            return date.atStartOfDay()
                    .plusHours(hours)
                    .plusMinutes(minutes)
                    .plusSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new DateTimeParseException("Non-numeric time field", startTime, 0, e);
        }
    }

    /**
     * Whole minutes from {@code now} until {@code departure}, rounded half up.
     */
    public static long etaMinutes(Instant now, Instant departure) {
        long millis = Duration.between(now, departure).toMillis();
        return Math.round(millis / 60000.0);
    }

    public static Instant fromEpochSeconds(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds);
    }

    /**
     * Instants are stored in UTC so the JVM default zone never shifts them.
     */
    public static OffsetDateTime toUtc(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    public static Instant toInstant(OffsetDateTime dateTime) {
        return dateTime != null ? dateTime.toInstant() : null;
    }
}
