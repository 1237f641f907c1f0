package com.flagship.pawnshop.common;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Calendar boundaries as instants in the clock's zone, for created_at based
 * filters and "this month"/"this year" statistics.
 */
public final class TimeWindows {

    private TimeWindows() {
        // Utility class
    }

    public static Instant startOfDay(LocalDate day, Clock clock) {
        return day.atStartOfDay(clock.getZone()).toInstant();
    }

    /**
     * Exclusive upper bound for an inclusive calendar day.
     */
    public static Instant endOfDay(LocalDate day, Clock clock) {
        return startOfDay(day.plusDays(1), clock);
    }

    public static Instant startOfMonth(YearMonth month, Clock clock) {
        return startOfDay(month.atDay(1), clock);
    }

    public static Instant startOfCurrentMonth(Clock clock) {
        return startOfMonth(YearMonth.now(clock), clock);
    }

    public static Instant startOfCurrentYear(Clock clock) {
        return startOfDay(LocalDate.now(clock).withDayOfYear(1), clock);
    }
}
