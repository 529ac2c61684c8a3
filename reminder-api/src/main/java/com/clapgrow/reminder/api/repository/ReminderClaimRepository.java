package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.Reminder;

import java.util.List;
import java.util.UUID;

/**
 * Atomic claim of due reminders, implemented with PostgreSQL row locks.
 */
public interface ReminderClaimRepository {

    /**
     * Claim up to {@code batchLimit} due reminders in one statement.
     *
     * Due means enabled, not deleted, status active and next_run_at_utc not in the
     * future. Rows locked by a concurrent claim are skipped, never waited on, so two
     * overlapping ticks never receive the same reminder. Claimed rows are returned
     * in processing state, earliest occurrence first.
     *
     * @param tickId     tick performing the claim
     * @param lockedBy   worker identity written to locked_by
     * @param batchLimit maximum number of rows
     * @return claimed reminders, possibly empty
     */
    List<Reminder> claimDue(UUID tickId, String lockedBy, int batchLimit);
}
