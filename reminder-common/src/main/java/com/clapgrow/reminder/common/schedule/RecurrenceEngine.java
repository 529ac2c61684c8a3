package com.clapgrow.reminder.common.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes the next occurrence of a {@link Schedule}.
 *
 * Pure and thread-safe. For every recurring schedule the returned instant is strictly
 * after the reference, so feeding a result back in always moves forward.
 *
 * Local wall-clock targets are converted with the zone's own rules: a time that falls
 * into a DST gap is shifted forward by the gap length, and an ambiguous time during
 * an overlap resolves to the earlier offset.
 */
public class RecurrenceEngine {

    /**
     * @param schedule  schedule to evaluate
     * @param reference instant the next occurrence must follow (usually the send time)
     * @return next occurrence, or {@code null} when a one-shot schedule has already fired
     */
    public Instant nextOccurrence(Schedule schedule, Instant reference) {
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(reference, "reference");

        if (schedule instanceof Schedule.Once once) {
            return once.at().isAfter(reference) ? once.at() : null;
        }
        if (schedule instanceof Schedule.Interval interval) {
            return reference.plus(Duration.ofMinutes(interval.minutes()));
        }

        ZoneId zone = schedule.zone();
        ZonedDateTime local = reference.atZone(zone);
        LocalDate today = local.toLocalDate();

        if (schedule instanceof Schedule.Daily daily) {
            Instant candidate = atLocal(today, daily.time(), zone);
            return candidate.isAfter(reference) ? candidate : atLocal(today.plusDays(1), daily.time(), zone);
        }
        if (schedule instanceof Schedule.Weekly weekly) {
            int daysAhead = (weekly.dayOfWeek().getValue() - today.getDayOfWeek().getValue() + 7) % 7;
            LocalDate target = today.plusDays(daysAhead);
            Instant candidate = atLocal(target, weekly.time(), zone);
            return candidate.isAfter(reference) ? candidate : atLocal(target.plusWeeks(1), weekly.time(), zone);
        }
        if (schedule instanceof Schedule.Monthly monthly) {
            YearMonth month = YearMonth.from(today);
            Instant candidate = atLocal(clamp(month, monthly.dayOfMonth()), monthly.time(), zone);
            if (candidate.isAfter(reference)) {
                return candidate;
            }
            return atLocal(clamp(month.plusMonths(1), monthly.dayOfMonth()), monthly.time(), zone);
        }
        if (schedule instanceof Schedule.Yearly yearly) {
            YearMonth thisYear = YearMonth.of(today.getYear(), yearly.month());
            Instant candidate = atLocal(clamp(thisYear, yearly.dayOfMonth()), yearly.time(), zone);
            if (candidate.isAfter(reference)) {
                return candidate;
            }
            return atLocal(clamp(thisYear.plusYears(1), yearly.dayOfMonth()), yearly.time(), zone);
        }
        throw new IllegalStateException("Unhandled schedule kind: " + schedule.kind());
    }

    /**
     * Day 31 in a 30-day month becomes day 30; February 29 becomes 28 in common years.
     */
    static LocalDate clamp(YearMonth month, int dayOfMonth) {
        return month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
    }

    static Instant atLocal(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }
}
