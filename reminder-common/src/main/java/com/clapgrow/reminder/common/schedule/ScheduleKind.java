package com.clapgrow.reminder.common.schedule;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kind of recurrence a reminder follows.
 *
 * Stored lowercase in the {@code reminders.schedule_type} column.
 */
public enum ScheduleKind {
    ONCE,
    INTERVAL,
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY;

    /**
     * Value used in the database column (e.g., "once", "weekly").
     */
    public String toColumnValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a schedule kind from its column value (case-insensitive).
     *
     * @param value column value
     * @return ScheduleKind enum value
     * @throws InvalidScheduleException if value doesn't match any kind
     */
    public static ScheduleKind fromColumnValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidScheduleException("Schedule type cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(
                "Unknown schedule type: " + value + ". Available: " + Arrays.toString(values()), e);
        }
    }
}
