package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.config.WorkerIdentity;
import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.api.repository.ReminderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Claims due reminders for a tick and gives back the ones the tick does not finish.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderDispatcher {

    private final ReminderRepository reminderRepository;
    private final WorkerIdentity workerIdentity;

    /**
     * Claim up to {@code maxBatch} due reminders, earliest first.
     * A storage error propagates; nothing stays claimed in that case.
     */
    public List<Reminder> claimDueJobs(UUID tickId, int maxBatch) {
        List<Reminder> claimed = reminderRepository.claimDue(tickId, workerIdentity.id(), maxBatch);
        log.debug("Claimed {} reminder(s): tickId={}, worker={}", claimed.size(), tickId, workerIdentity.id());
        return claimed;
    }

    /**
     * Put claimed reminders back to active without touching their schedule.
     * Failures are logged; stale-claim recovery picks the rows up later.
     *
     * @return number of rows released
     */
    public int release(List<Reminder> reminders) {
        if (reminders.isEmpty()) {
            return 0;
        }
        List<UUID> ids = reminders.stream().map(Reminder::getId).toList();
        try {
            int released = reminderRepository.releaseClaims(ids);
            log.info("Released {} claimed reminder(s)", released);
            return released;
        } catch (DataAccessException e) {
            log.warn("Failed to release {} claimed reminder(s): {}", ids.size(), e.getMessage());
            return 0;
        }
    }
}
