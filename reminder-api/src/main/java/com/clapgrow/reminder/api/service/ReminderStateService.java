package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.api.enums.ReminderStatus;
import com.clapgrow.reminder.api.repository.ReminderRepository;
import com.clapgrow.reminder.common.retry.DeliveryFailure;
import com.clapgrow.reminder.common.retry.RetryPolicyResolver;
import com.clapgrow.reminder.common.retry.RetryPolicyResolver.RetryPolicy;
import com.clapgrow.reminder.common.schedule.RecurrenceEngine;
import com.clapgrow.reminder.common.schedule.Schedule;
import com.clapgrow.reminder.common.schedule.ScheduleParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Moves a claimed reminder out of processing after a delivery attempt.
 *
 * Success: recurring reminders get their next occurrence and go back to active;
 * one-shot reminders ring (disabled, no next occurrence).
 * Failure: the attempt counter grows and the reminder is parked as failed with a
 * retry-not-before instant taken from the retry policy of the failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderStateService {

    private final ReminderRepository reminderRepository;
    private final ScheduleParser scheduleParser;
    private final RecurrenceEngine recurrenceEngine;
    private final RetryPolicyResolver retryPolicyResolver;
    private final Clock clock;

    /**
     * @throws com.clapgrow.reminder.common.schedule.InvalidScheduleException if the schedule columns are unusable
     */
    public Schedule scheduleOf(Reminder reminder) {
        return scheduleParser.parse(reminder.toScheduleColumns());
    }

    /**
     * Next occurrence after {@code reference}, or null for a one-shot schedule.
     */
    public Instant nextOccurrence(Schedule schedule, Instant reference) {
        if (!schedule.isRecurring()) {
            return null;
        }
        return recurrenceEngine.nextOccurrence(schedule, reference);
    }

    public void applySuccess(Reminder reminder, Schedule schedule, Instant sentAt, Instant nextRunAt, UUID tickId) {
        if (schedule.isRecurring()) {
            reminderRepository.markDelivered(reminder.getId(), ReminderStatus.ACTIVE, true, nextRunAt, sentAt, tickId);
            log.debug("Reminder {} rescheduled to {}", reminder.getId(), nextRunAt);
        } else {
            reminderRepository.markDelivered(reminder.getId(), ReminderStatus.RINGED, false, null, sentAt, tickId);
            log.debug("One-shot reminder {} rang", reminder.getId());
        }
    }

    public FailureOutcome applyFailure(Reminder reminder, DeliveryFailure failure, UUID tickId) {
        int attemptCount = reminder.getSendAttemptCount() + 1;
        RetryPolicy policy = retryPolicyResolver.resolve(failure.classification());
        long delaySeconds = policy.delaySeconds(attemptCount, failure.retryHintSeconds());
        Instant retryAfter = clock.instant().plusSeconds(delaySeconds);

        reminderRepository.markFailed(reminder.getId(), attemptCount, failure.errorMessage(), retryAfter, tickId);
        return new FailureOutcome(attemptCount, retryAfter, policy.abortBatch());
    }

    /**
     * @param attemptCount attempts made so far, including the failed one
     * @param retryAfter   earliest instant the reminder may be retried
     * @param abortBatch   whether the rest of the tick's batch must be released
     */
    public record FailureOutcome(int attemptCount, Instant retryAfter, boolean abortBatch) {
    }
}
