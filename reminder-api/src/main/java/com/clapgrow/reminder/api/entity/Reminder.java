package com.clapgrow.reminder.api.entity;

import com.clapgrow.reminder.api.enums.ReminderStatus;
import com.clapgrow.reminder.common.schedule.ScheduleColumns;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "reminders", indexes = {
    @Index(name = "idx_reminders_due", columnList = "next_run_at_utc, status"),
    @Index(name = "idx_reminders_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Reminder extends BaseTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "archive_item_id")
    private UUID archiveItemId;

    @Column(name = "schedule_type", nullable = false)
    private String scheduleType = "once";

    @Column(name = "timezone")
    private String timezone;

    @Column(name = "once_at")
    private Instant onceAt;

    @Column(name = "interval_minutes")
    private Integer intervalMinutes;

    /**
     * Local time of day, "HH:mm".
     */
    @Column(name = "at_time")
    private String atTime;

    /**
     * 0 = Sunday .. 6 = Saturday.
     */
    @Column(name = "by_weekday")
    private Integer byWeekday;

    @Column(name = "by_monthday")
    private Integer byMonthday;

    @Column(name = "by_month")
    private Integer byMonth;

    /**
     * Null only once a one-shot reminder has been delivered.
     */
    @Column(name = "next_run_at_utc")
    private Instant nextRunAtUtc;

    @Column(name = "last_sent_at_utc")
    private Instant lastSentAtUtc;

    @Column(name = "status", nullable = false)
    private ReminderStatus status = ReminderStatus.ACTIVE;

    @Column(name = "send_attempt_count", nullable = false)
    private int sendAttemptCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "retry_after_utc")
    private Instant retryAfterUtc;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "last_tick_id")
    private UUID lastTickId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    public boolean isOnce() {
        return "once".equalsIgnoreCase(scheduleType);
    }

    public ScheduleColumns toScheduleColumns() {
        return new ScheduleColumns(
            scheduleType,
            timezone,
            onceAt,
            intervalMinutes,
            atTime,
            byWeekday,
            byMonthday,
            byMonth
        );
    }
}
