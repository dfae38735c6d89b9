package com.baladi.settlement.service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.time.temporal.WeekFields;

/**
 * Boundaries of a Saturday 00:00 to Friday 23:59:59 week in a fixed zone.
 *
 * <p>The result depends only on the instant and the zone, never on the JVM default
 * zone. Weeks are numbered with Saturday as the first day and the week containing
 * January 1st as week 1.</p>
 *
 * @param start     Saturday 00:00, inclusive
 * @param end       Friday 23:59:59, inclusive
 * @param nextStart following Saturday 00:00, exclusive window end
 */
public record SettlementWeek(int year, int weekNumber, Instant start, Instant end, Instant nextStart) {

    private static final WeekFields SATURDAY_WEEKS = WeekFields.of(DayOfWeek.SATURDAY, 1);

    public static SettlementWeek containing(Instant instant, ZoneId zone) {
        LocalDate saturday = instant.atZone(zone).toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.SATURDAY));
        return startingOn(saturday, zone);
    }

    public static SettlementWeek startingOn(LocalDate saturday, ZoneId zone) {
        ZonedDateTime start = saturday.atStartOfDay(zone);
        ZonedDateTime nextStart = saturday.plusWeeks(1).atStartOfDay(zone);
        return new SettlementWeek(
                saturday.get(SATURDAY_WEEKS.weekBasedYear()),
                saturday.get(SATURDAY_WEEKS.weekOfWeekBasedYear()),
                start.toInstant(),
                nextStart.toInstant().minusSeconds(1),
                nextStart.toInstant());
    }

    public SettlementWeek next(ZoneId zone) {
        return containing(nextStart, zone);
    }
}
