package com.clapgrow.reminder.api.enums;

import java.util.Arrays;

/**
 * Lifecycle state of a reminder row.
 *
 * active -> processing -> active (recurring success, release)
 * active -> processing -> ringed (one-shot success, reminder disabled)
 * active -> processing -> failed (send error)
 */
public enum ReminderStatus {
    ACTIVE("active"),
    PROCESSING("processing"),
    RINGED("ringed"),
    FAILED("failed");

    private final String columnValue;

    ReminderStatus(String columnValue) {
        this.columnValue = columnValue;
    }

    public String getColumnValue() {
        return columnValue;
    }

    public static ReminderStatus fromColumnValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.columnValue.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown reminder status: " + value));
    }
}
