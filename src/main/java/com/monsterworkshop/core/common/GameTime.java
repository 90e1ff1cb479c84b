package com.monsterworkshop.core.common;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Real-time / game-time conversion and timestamp handling.
 *
 * One real second is thirty game seconds. Timestamps are stored as UTC
 * ISO-8601 local date-times (no offset), offsets are tolerated on read.
 */
public final class GameTime {

    public static final int GAME_TIME_MULTIPLIER = 30;

    private static final double SECONDS_PER_DAY = 24 * 60 * 60;

    private GameTime() {}

    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
    }

    public static String nowIso(Clock clock) {
        return format(now(clock));
    }

    public static String format(LocalDateTime time) {
        return time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    /**
     * Null for missing or unparseable values.
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }

    public static double realSecondsBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toMillis() / 1000.0;
    }

    public static double realDaysBetween(LocalDateTime from, LocalDateTime to) {
        return realSecondsBetween(from, to) / SECONDS_PER_DAY;
    }

    public static double gameDaysBetween(LocalDateTime from, LocalDateTime to) {
        return realSecondsBetween(from, to) * GAME_TIME_MULTIPLIER / SECONDS_PER_DAY;
    }
}
