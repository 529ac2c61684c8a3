package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.Reminder;
import com.clapgrow.reminder.api.enums.ReminderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

/**
 * Reminder rows. State transitions of claimed reminders are single native UPDATEs
 * so they never depend on a stale entity snapshot; callers provide the transaction.
 */
@Repository
public interface ReminderRepository extends JpaRepository<Reminder, UUID>, ReminderClaimRepository {

    /**
     * Record a successful delivery and move the reminder to its next state.
     *
     * @param id        Reminder ID
     * @param status    ACTIVE for recurring reminders, RINGED for a delivered one-shot
     * @param enabled   false once a one-shot reminder has rung
     * @param nextRunAt next occurrence, null for a delivered one-shot
     * @param sentAt    reference instant of the delivery
     * @param tickId    tick that performed the delivery
     * @return Number of rows updated
     *
     * @apiNote This is the preferred public API. Use this method in services.
     */
    default int markDelivered(UUID id, ReminderStatus status, boolean enabled, Instant nextRunAt,
                              Instant sentAt, UUID tickId) {
        return markDeliveredInternal(id, status.getColumnValue(), enabled, nextRunAt, sentAt, tickId);
    }

    /**
     * Internal helper method for native query execution.
     * Use markDelivered(UUID, ReminderStatus, boolean, Instant, Instant, UUID) instead.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE reminders SET status = :status, enabled = :enabled, next_run_at_utc = :nextRunAt, "
        + "last_sent_at_utc = :sentAt, send_attempt_count = 0, last_error = NULL, retry_after_utc = NULL, "
        + "locked_at = NULL, locked_by = NULL, last_tick_id = :tickId, updated_at = now() "
        + "WHERE id = :id", nativeQuery = true)
    int markDeliveredInternal(
        @Param("id") UUID id,
        @Param("status") String status,
        @Param("enabled") boolean enabled,
        @Param("nextRunAt") Instant nextRunAt,
        @Param("sentAt") Instant sentAt,
        @Param("tickId") UUID tickId
    );

    /**
     * Record a failed delivery. The reminder leaves the claimable set until it is reactivated.
     *
     * @param id           Reminder ID
     * @param attemptCount attempt count including the failed one
     * @param error        error text (e.g. "rate_limited:30")
     * @param retryAfter   earliest instant a retry may happen
     * @param tickId       tick that performed the attempt
     * @return Number of rows updated
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE reminders SET status = 'failed', send_attempt_count = :attemptCount, "
        + "last_error = :error, retry_after_utc = :retryAfter, locked_at = NULL, locked_by = NULL, "
        + "last_tick_id = :tickId, updated_at = now() "
        + "WHERE id = :id", nativeQuery = true)
    int markFailed(
        @Param("id") UUID id,
        @Param("attemptCount") int attemptCount,
        @Param("error") String error,
        @Param("retryAfter") Instant retryAfter,
        @Param("tickId") UUID tickId
    );

    /**
     * Give claimed reminders back to the pool without touching their schedule.
     * Only rows still in processing are affected.
     *
     * @param ids Reminder IDs claimed by the current tick
     * @return Number of rows released
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE reminders SET status = 'active', locked_at = NULL, locked_by = NULL, updated_at = now() "
        + "WHERE id IN (:ids) AND status = 'processing'", nativeQuery = true)
    int releaseClaims(@Param("ids") Collection<UUID> ids);

    /**
     * Release claims whose owner did not finish them before the cutoff.
     *
     * @param lockedBefore claims taken before this instant are considered abandoned
     * @return Number of rows released
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE reminders SET status = 'active', locked_at = NULL, locked_by = NULL, updated_at = now() "
        + "WHERE status = 'processing' AND (locked_at IS NULL OR locked_at < :lockedBefore)", nativeQuery = true)
    int releaseStaleClaims(@Param("lockedBefore") Instant lockedBefore);

    /**
     * Put failed reminders whose backoff has elapsed back into the claimable set.
     *
     * @param now         current instant
     * @param maxAttempts reminders with this many attempts or more stay failed
     * @return Number of rows reactivated
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE reminders SET status = 'active', updated_at = now() "
        + "WHERE status = 'failed' AND enabled = TRUE AND deleted_at IS NULL "
        + "AND retry_after_utc IS NOT NULL AND retry_after_utc <= :now "
        + "AND send_attempt_count < :maxAttempts", nativeQuery = true)
    int reactivateDueFailures(@Param("now") Instant now, @Param("maxAttempts") int maxAttempts);

    /**
     * Manually reactivate one failed reminder and reset its attempt counter.
     *
     * @param id Reminder ID
     * @return 1 if the reminder was failed and is now active, 0 otherwise
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query(value = "UPDATE reminders SET status = 'active', send_attempt_count = 0, last_error = NULL, "
        + "retry_after_utc = NULL, updated_at = now() "
        + "WHERE id = :id AND status = 'failed' AND deleted_at IS NULL", nativeQuery = true)
    int reactivateFailed(@Param("id") UUID id);

    @Query("SELECT MAX(r.lastSentAtUtc) FROM Reminder r")
    Instant findLatestSentAt();
}
