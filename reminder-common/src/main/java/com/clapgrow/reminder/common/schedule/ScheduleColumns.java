package com.clapgrow.reminder.common.schedule;

import java.time.Instant;

/**
 * Raw schedule columns as persisted on a reminder row.
 *
 * @param scheduleType    once / interval / daily / weekly / monthly / yearly
 * @param timezone        IANA zone name, may be blank
 * @param onceAt          fire instant for one-shot reminders
 * @param intervalMinutes period for interval reminders
 * @param atTime          local time of day, "HH:mm"
 * @param byWeekday       0 = Sunday .. 6 = Saturday
 * @param byMonthday      1..31
 * @param byMonth         1..12
 */
public record ScheduleColumns(
    String scheduleType,
    String timezone,
    Instant onceAt,
    Integer intervalMinutes,
    String atTime,
    Integer byWeekday,
    Integer byMonthday,
    Integer byMonth
) {
}
