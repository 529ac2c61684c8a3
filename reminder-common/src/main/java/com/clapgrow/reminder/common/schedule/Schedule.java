package com.clapgrow.reminder.common.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.util.Objects;

/**
 * When a reminder fires.
 *
 * One record per {@link ScheduleKind}; each carries only the fields its kind needs.
 * Every variant keeps the owner's IANA zone so daily-and-slower kinds are computed
 * against local wall-clock time, never UTC.
 */
public sealed interface Schedule
        permits Schedule.Once, Schedule.Interval, Schedule.Daily,
                Schedule.Weekly, Schedule.Monthly, Schedule.Yearly {

    ZoneId zone();

    ScheduleKind kind();

    default boolean isRecurring() {
        return kind() != ScheduleKind.ONCE;
    }

    record Once(ZoneId zone, Instant at) implements Schedule {
        public Once {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(at, "at");
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.ONCE;
        }
    }

    record Interval(ZoneId zone, int minutes) implements Schedule {
        public Interval {
            Objects.requireNonNull(zone, "zone");
            if (minutes <= 0) {
                throw new InvalidScheduleException("Interval minutes must be positive, got " + minutes);
            }
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.INTERVAL;
        }
    }

    record Daily(ZoneId zone, LocalTime time) implements Schedule {
        public Daily {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(time, "time");
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.DAILY;
        }
    }

    record Weekly(ZoneId zone, DayOfWeek dayOfWeek, LocalTime time) implements Schedule {
        public Weekly {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(dayOfWeek, "dayOfWeek");
            Objects.requireNonNull(time, "time");
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.WEEKLY;
        }
    }

    /**
     * Day-of-month may exceed the length of shorter months; it is clamped per occurrence.
     */
    record Monthly(ZoneId zone, int dayOfMonth, LocalTime time) implements Schedule {
        public Monthly {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(time, "time");
            if (dayOfMonth < 1 || dayOfMonth > 31) {
                throw new InvalidScheduleException("Day of month must be within 1..31, got " + dayOfMonth);
            }
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.MONTHLY;
        }
    }

    record Yearly(ZoneId zone, Month month, int dayOfMonth, LocalTime time) implements Schedule {
        public Yearly {
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(month, "month");
            Objects.requireNonNull(time, "time");
            if (dayOfMonth < 1 || dayOfMonth > month.maxLength()) {
                throw new InvalidScheduleException(
                    "Day of month must be within 1.." + month.maxLength() + " for " + month + ", got " + dayOfMonth);
            }
        }

        @Override
        public ScheduleKind kind() {
            return ScheduleKind.YEARLY;
        }
    }
}
