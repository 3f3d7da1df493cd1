package com.wordchains.dailypuzzle.schedule;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Civil UTC date keys ("yyyy-MM-dd") and the day arithmetic built on them.
 */
public final class DayKeys {

    public static final long MILLIS_PER_DAY = 86_400_000L;

    private DayKeys() {
    }

    /**
     * Parse a date key.
     *
     * @throws IllegalArgumentException if the key is not an ISO calendar date
     */
    public static LocalDate parse(String dateKey) {
        if (dateKey == null) {
            throw new IllegalArgumentException("Date key is required");
        }
        try {
            return LocalDate.parse(dateKey.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date key: " + dateKey, e);
        }
    }

    public static String toKey(LocalDate date) {
        return date.toString();
    }

    /**
     * Days since the epoch of the UTC midnight starting the date.
     */
    public static long dayIndex(String dateKey) {
        long epochMillis = parse(dateKey).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return Math.floorDiv(epochMillis, MILLIS_PER_DAY);
    }

    /**
     * The {@code days} date keys before the given one, most recent first.
     */
    public static List<String> recentDateKeys(String dateKey, int days) {
        LocalDate base = parse(dateKey);
        List<String> keys = new ArrayList<>();
        for (int i = 1; i <= days; i++) {
            keys.add(toKey(base.minusDays(i)));
        }
        return keys;
    }

    /**
     * User-facing day number counted from the launch date, never below 1.
     *
     * @return Empty when no launch date is configured
     */
    public static OptionalLong dayNumber(String dateKey, String launchKey) {
        if (launchKey == null || launchKey.isBlank()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.max(1, dayIndex(dateKey) - dayIndex(launchKey) + 1));
    }
}
