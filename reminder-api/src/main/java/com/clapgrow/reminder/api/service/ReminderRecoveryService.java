package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.config.CronProperties;
import com.clapgrow.reminder.api.exception.ReminderNotFoundException;
import com.clapgrow.reminder.api.repository.ReminderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Puts reminders stuck outside the claimable set back into it.
 *
 * Runs at the start of every tick:
 * - claims older than cron.stale-lock-timeout-seconds are released (their tick died)
 * - with cron.failed-retry.enabled, failed reminders past retry_after_utc are reactivated
 *   until they reach cron.failed-retry.max-attempts
 *
 * Failed reminders can also be reactivated one at a time through {@link #reactivate(UUID)}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderRecoveryService {

    private final ReminderRepository reminderRepository;
    private final CronProperties cronProperties;
    private final Clock clock;

    public void recover() {
        releaseStaleClaims();
        reactivateDueFailures();
    }

    int releaseStaleClaims() {
        long timeoutSeconds = cronProperties.getStaleLockTimeoutSeconds();
        if (timeoutSeconds <= 0) {
            return 0;
        }
        try {
            Instant cutoff = clock.instant().minusSeconds(timeoutSeconds);
            int released = reminderRepository.releaseStaleClaims(cutoff);
            if (released > 0) {
                log.warn("Released {} stale claim(s) locked before {}", released, cutoff);
            }
            return released;
        } catch (DataAccessException e) {
            log.warn("Failed to release stale claims: {}", e.getMessage());
            return 0;
        }
    }

    int reactivateDueFailures() {
        CronProperties.FailedRetry failedRetry = cronProperties.getFailedRetry();
        if (!failedRetry.isEnabled()) {
            return 0;
        }
        try {
            int reactivated = reminderRepository.reactivateDueFailures(clock.instant(), failedRetry.getMaxAttempts());
            if (reactivated > 0) {
                log.info("Reactivated {} failed reminder(s) for retry", reactivated);
            }
            return reactivated;
        } catch (DataAccessException e) {
            log.warn("Failed to reactivate failed reminders: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Manually resolve a failed reminder: back to active with a fresh attempt counter.
     *
     * @throws ReminderNotFoundException if the reminder does not exist
     * @throws IllegalStateException      if the reminder is not failed
     */
    public void reactivate(UUID reminderId) {
        if (!reminderRepository.existsById(reminderId)) {
            throw new ReminderNotFoundException(reminderId);
        }
        int updated = reminderRepository.reactivateFailed(reminderId);
        if (updated == 0) {
            throw new IllegalStateException("Reminder " + reminderId + " is not in failed state");
        }
        log.info("Reminder {} manually reactivated", reminderId);
    }
}
