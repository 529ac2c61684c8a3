package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.Reminder;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

public class ReminderClaimRepositoryImpl implements ReminderClaimRepository {

    private static final String CLAIM_DUE_SQL = """
        WITH due AS (
            SELECT r.id
            FROM reminders r
            WHERE r.enabled = TRUE
              AND r.deleted_at IS NULL
              AND r.status = 'active'
              AND r.next_run_at_utc IS NOT NULL
              AND r.next_run_at_utc <= now()
            ORDER BY r.next_run_at_utc ASC
            LIMIT :batchLimit
            FOR UPDATE SKIP LOCKED
        ), claimed AS (
            UPDATE reminders r
            SET status = 'processing',
                locked_at = now(),
                locked_by = :lockedBy,
                last_tick_id = :tickId,
                updated_at = now()
            FROM due
            WHERE r.id = due.id
            RETURNING r.*
        )
        SELECT * FROM claimed ORDER BY next_run_at_utc ASC
        """;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public List<Reminder> claimDue(UUID tickId, String lockedBy, int batchLimit) {
        if (batchLimit <= 0) {
            return List.of();
        }
        return entityManager.createNativeQuery(CLAIM_DUE_SQL, Reminder.class)
            .setParameter("batchLimit", batchLimit)
            .setParameter("lockedBy", lockedBy)
            .setParameter("tickId", tickId)
            .getResultList();
    }
}
