package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.config.CronProperties;
import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.common.retry.DeliveryFailure;
import com.clapgrow.reminder.common.schedule.Schedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Runs one tick of the reminder pipeline.
 *
 * Flow:
 * 1. Record the run start, recover stale claims, claim a batch of due reminders
 * 2. For each reminder, in claim order:
 *    - stop and release the rest once the runtime budget is spent
 *    - occurrence already delivered (ledger) -> only advance the reminder, count as skipped;
 *      a later failure of such a reminder never touches its ledger record
 *    - otherwise send, record the delivery, advance the reminder, count as sent
 *    - on failure record it and back off; a rate limit also releases the rest of the batch
 * 3. Record the run result
 *
 * Reminders are processed sequentially; overlapping ticks are kept apart by the claim alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CronTickService {

    private final CronProperties cronProperties;
    private final ReminderRecoveryService recoveryService;
    private final ReminderDispatcher dispatcher;
    private final DeliveryLedgerService ledgerService;
    private final ReminderStateService stateService;
    private final ReminderDeliveryService deliveryService;
    private final FailureClassifier failureClassifier;
    private final ArchiveService archiveService;
    private final CronRunService cronRunService;
    private final CronMetricsService metricsService;
    private final Clock clock;

    public CronTickResult runTick() {
        UUID tickId = UUID.randomUUID();
        Instant startedAt = clock.instant();
        TickCounters counts = new TickCounters();
        String error = null;

        cronRunService.start(tickId, startedAt);
        log.info("Cron tick started: tickId={}", tickId);

        try {
            recoveryService.recover();
            List<Reminder> claimed = dispatcher.claimDueJobs(tickId, cronProperties.getMaxBatch());
            counts.claimed = claimed.size();
            processBatch(tickId, claimed, startedAt, counts);
        } catch (RuntimeException e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Cron tick failed: tickId={}, error={}", tickId, error, e);
        }

        Instant finishedAt = clock.instant();
        CronTickResult result = new CronTickResult(
            error == null,
            tickId,
            counts.claimed,
            counts.sent,
            counts.failed,
            counts.skipped,
            Duration.between(startedAt, finishedAt).toMillis(),
            error
        );
        cronRunService.finish(result, startedAt, finishedAt);
        metricsService.recordTick(result);

        log.info("Cron tick finished: tickId={}, ok={}, claimed={}, sent={}, failed={}, skipped={}, durationMs={}",
            tickId, result.ok(), result.claimed(), result.sent(), result.failed(), result.skipped(), result.durationMs());
        return result;
    }

    private void processBatch(UUID tickId, List<Reminder> reminders, Instant startedAt, TickCounters counts) {
        int index = 0;
        try {
            while (index < reminders.size()) {
                if (budgetExhausted(startedAt)) {
                    List<Reminder> remaining = reminders.subList(index, reminders.size());
                    log.warn("Tick runtime budget of {}ms spent, releasing {} reminder(s): tickId={}",
                        cronProperties.getMaxRuntimeMs(), remaining.size(), tickId);
                    releaseRemaining(remaining, counts);
                    return;
                }

                JobOutcome outcome = processReminder(tickId, reminders.get(index), counts);
                index++;

                if (outcome == JobOutcome.ABORT_BATCH) {
                    List<Reminder> remaining = reminders.subList(index, reminders.size());
                    if (!remaining.isEmpty()) {
                        log.warn("Rate limited, releasing {} reminder(s): tickId={}", remaining.size(), tickId);
                    }
                    releaseRemaining(remaining, counts);
                    return;
                }

                if (outcome == JobOutcome.SENT && index < reminders.size() && !pauseBetweenSends()) {
                    List<Reminder> remaining = reminders.subList(index, reminders.size());
                    log.warn("Tick interrupted, releasing {} reminder(s): tickId={}", remaining.size(), tickId);
                    releaseRemaining(remaining, counts);
                    return;
                }
            }
        } catch (RuntimeException e) {
            // the reminder at index is already counted as failed but has no state written yet
            dispatcher.release(reminders.subList(index, reminders.size()));
            counts.skipped += reminders.size() - index - 1;
            throw e;
        }
    }

    private JobOutcome processReminder(UUID tickId, Reminder reminder, TickCounters counts) {
        Instant occurrence = reminder.getNextRunAtUtc() != null ? reminder.getNextRunAtUtc() : clock.instant();
        String deliveryKey = DeliveryLedgerService.deliveryKey(reminder.getId(), occurrence);

        boolean alreadyDelivered = false;
        Schedule schedule;
        try {
            alreadyDelivered = ledgerService.hasSucceeded(reminder.getId(), deliveryKey);
            schedule = stateService.scheduleOf(reminder);
            if (!alreadyDelivered) {
                deliveryService.deliver(reminder);
            }
        } catch (RuntimeException e) {
            // a delivered occurrence keeps its ok=true ledger record
            return recordFailure(tickId, reminder, deliveryKey, !alreadyDelivered, e, counts);
        }

        if (alreadyDelivered) {
            return completeAlreadyDelivered(tickId, reminder, schedule, occurrence, deliveryKey, counts);
        }
        return completeDelivered(tickId, reminder, schedule, deliveryKey, counts);
    }

    private JobOutcome completeAlreadyDelivered(UUID tickId, Reminder reminder, Schedule schedule,
                                                Instant occurrence, String deliveryKey, TickCounters counts) {
        try {
            Instant nextRunAt = stateService.nextOccurrence(schedule, occurrence);
            stateService.applySuccess(reminder, schedule, occurrence, nextRunAt, tickId);
        } catch (RuntimeException e) {
            return bookkeepingFailed(tickId, reminder, deliveryKey, e, counts);
        }

        counts.skipped++;
        if (!schedule.isRecurring()) {
            markArchiveRinged(tickId, reminder);
        }
        log.info("Reminder skipped due to idempotency: tickId={}, reminderId={}, deliveryKey={}",
            tickId, reminder.getId(), deliveryKey);
        return JobOutcome.SKIPPED;
    }

    private JobOutcome completeDelivered(UUID tickId, Reminder reminder, Schedule schedule,
                                         String deliveryKey, TickCounters counts) {
        Instant sentAt = clock.instant();
        try {
            ledgerService.record(reminder.getId(), deliveryKey, tickId, true, null);
            Instant nextRunAt = stateService.nextOccurrence(schedule, sentAt);
            stateService.applySuccess(reminder, schedule, sentAt, nextRunAt, tickId);
        } catch (RuntimeException e) {
            return bookkeepingFailed(tickId, reminder, deliveryKey, e, counts);
        }

        counts.sent++;
        if (!schedule.isRecurring()) {
            markArchiveRinged(tickId, reminder);
        }
        log.info("Reminder sent: tickId={}, reminderId={}, userId={}, scheduleType={}",
            tickId, reminder.getId(), reminder.getUserId(), reminder.getScheduleType());
        return JobOutcome.SENT;
    }

    private JobOutcome recordFailure(UUID tickId, Reminder reminder, String deliveryKey, boolean recordInLedger,
                                     RuntimeException error, TickCounters counts) {
        DeliveryFailure failure = failureClassifier.classify(error);
        counts.failed++;

        if (recordInLedger) {
            ledgerService.record(reminder.getId(), deliveryKey, tickId, false, failure.errorMessage());
        }
        ReminderStateService.FailureOutcome outcome = stateService.applyFailure(reminder, failure, tickId);

        log.error("Reminder send failed: tickId={}, reminderId={}, userId={}, scheduleType={}, attempt={}, retryAfter={}, error={}",
            tickId, reminder.getId(), reminder.getUserId(), reminder.getScheduleType(),
            outcome.attemptCount(), outcome.retryAfter(), failure.errorMessage());
        return outcome.abortBatch() ? JobOutcome.ABORT_BATCH : JobOutcome.FAILED;
    }

    /**
     * The message went out (or had gone out) but its bookkeeping could not be written.
     * The ledger is left alone and the claim released, so the next tick retries the
     * bookkeeping instead of parking a delivered reminder as failed.
     */
    private JobOutcome bookkeepingFailed(UUID tickId, Reminder reminder, String deliveryKey,
                                         RuntimeException error, TickCounters counts) {
        counts.failed++;
        log.error("Failed to record delivery: tickId={}, reminderId={}, deliveryKey={}, error={}",
            tickId, reminder.getId(), deliveryKey, error.getMessage(), error);
        dispatcher.release(List.of(reminder));
        return JobOutcome.FAILED;
    }

    private void markArchiveRinged(UUID tickId, Reminder reminder) {
        try {
            archiveService.markRinged(reminder);
        } catch (RuntimeException e) {
            log.warn("Failed to mark archive item as ringed: tickId={}, reminderId={}, error={}",
                tickId, reminder.getId(), e.getMessage());
        }
    }

    private void releaseRemaining(List<Reminder> remaining, TickCounters counts) {
        if (remaining.isEmpty()) {
            return;
        }
        dispatcher.release(remaining);
        counts.skipped += remaining.size();
    }

    private boolean budgetExhausted(Instant startedAt) {
        long elapsedMs = Duration.between(startedAt, clock.instant()).toMillis();
        return elapsedMs > cronProperties.getMaxRuntimeMs();
    }

    /**
     * @return false if the thread was interrupted while pausing
     */
    private boolean pauseBetweenSends() {
        long delayMs = cronProperties.getSendDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private enum JobOutcome {
        SENT,
        SKIPPED,
        FAILED,
        ABORT_BATCH
    }

    private static final class TickCounters {
        private int claimed;
        private int sent;
        private int failed;
        private int skipped;
    }
}
