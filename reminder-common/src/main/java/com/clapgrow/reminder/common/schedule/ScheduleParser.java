package com.clapgrow.reminder.common.schedule;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Builds a {@link Schedule} from the loosely-typed columns of a reminder row.
 *
 * Only the columns relevant to the schedule type are read; a missing or out-of-range
 * value for one of them raises {@link InvalidScheduleException}.
 */
public class ScheduleParser {

    private final ZoneId defaultZone;

    public ScheduleParser(ZoneId defaultZone) {
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone");
    }

    public Schedule parse(ScheduleColumns columns) {
        ScheduleKind kind = ScheduleKind.fromColumnValue(columns.scheduleType());
        ZoneId zone = resolveZone(columns.timezone());

        return switch (kind) {
            case ONCE -> new Schedule.Once(zone, require(columns.onceAt(), "once_at", kind));
            case INTERVAL -> new Schedule.Interval(zone, require(columns.intervalMinutes(), "interval_minutes", kind));
            case DAILY -> new Schedule.Daily(zone, parseTime(columns.atTime(), kind));
            case WEEKLY -> new Schedule.Weekly(
                zone,
                toDayOfWeek(require(columns.byWeekday(), "by_weekday", kind)),
                parseTime(columns.atTime(), kind));
            case MONTHLY -> new Schedule.Monthly(
                zone,
                require(columns.byMonthday(), "by_monthday", kind),
                parseTime(columns.atTime(), kind));
            case YEARLY -> new Schedule.Yearly(
                zone,
                toMonth(require(columns.byMonth(), "by_month", kind)),
                require(columns.byMonthday(), "by_monthday", kind),
                parseTime(columns.atTime(), kind));
        };
    }

    private ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.trim().isEmpty()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, e);
        }
    }

    private static LocalTime parseTime(String atTime, ScheduleKind kind) {
        String value = require(atTime, "at_time", kind).trim();
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidScheduleException("Invalid at_time '" + atTime + "' for " + kind.toColumnValue() + " schedule", e);
        }
    }

    // 0 = Sunday, matching the weekday index the reminder editor stores
    static DayOfWeek toDayOfWeek(int index) {
        if (index < 0 || index > 6) {
            throw new InvalidScheduleException("Weekday index must be within 0..6, got " + index);
        }
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    private static Month toMonth(int month) {
        if (month < 1 || month > 12) {
            throw new InvalidScheduleException("Month must be within 1..12, got " + month);
        }
        return Month.of(month);
    }

    private static <T> T require(T value, String column, ScheduleKind kind) {
        if (value == null) {
            throw new InvalidScheduleException(column + " is required for " + kind.toColumnValue() + " schedules");
        }
        return value;
    }
}
