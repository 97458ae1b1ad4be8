package com.opensensor.querycache;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Maps a reading timestamp to the time bucket used in aggregated chunk keys. All buckets are
 * computed in UTC.
 *
 * <ul>
 *   <li>resolution up to one hour: {@code yyyy-MM-dd-HH}</li>
 *   <li>resolution up to one day: {@code yyyy-MM-dd}</li>
 *   <li>coarser resolutions: the Monday opening the week, as {@code yyyy-Www}</li>
 * </ul>
 *
 * <p>The week number counts Sunday-started weeks; days before the first Sunday of the year fall
 * in week {@code 00}.</p>
 */
public final class TimeBuckets {

    private static final DateTimeFormatter HOURLY = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");
    private static final DateTimeFormatter DAILY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final int MINUTES_PER_HOUR = 60;
    private static final int MINUTES_PER_DAY = 1440;

    private TimeBuckets() {
    }

    public static String bucketFor(Instant timestamp, int resolutionMinutes) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        if (resolutionMinutes <= 0) {
            throw new IllegalArgumentException("resolutionMinutes must be positive: " + resolutionMinutes);
        }
        LocalDateTime utc = LocalDateTime.ofInstant(timestamp, ZoneOffset.UTC);
        if (resolutionMinutes <= MINUTES_PER_HOUR) {
            return HOURLY.format(utc);
        }
        if (resolutionMinutes <= MINUTES_PER_DAY) {
            return DAILY.format(utc);
        }
        LocalDate weekStart = utc.toLocalDate()
                .minusDays(utc.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue());
        return String.format("%04d-W%02d", weekStart.getYear(), sundayBasedWeekOfYear(weekStart));
    }

    private static int sundayBasedWeekOfYear(LocalDate date) {
        int zeroBasedDayOfYear = date.getDayOfYear() - 1;
        int daysSinceSunday = date.getDayOfWeek().getValue() % 7;
        return (zeroBasedDayOfYear + 7 - daysSinceSunday) / 7;
    }
}
