package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.CronRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CronRunRepository extends JpaRepository<CronRun, UUID> {

    Optional<CronRun> findFirstByOrderByStartedAtDesc();

    /**
     * Latest finished run that delivered at least one reminder.
     */
    Optional<CronRun> findFirstBySentGreaterThanAndFinishedAtIsNotNullOrderByFinishedAtDesc(int sent);

    @Transactional
    @Modifying
    @Query(value = "UPDATE cron_runs SET finished_at = :finishedAt, claimed = :claimed, sent = :sent, "
        + "failed = :failed, skipped = :skipped, notes = :notes WHERE tick_id = :tickId", nativeQuery = true)
    int finish(
        @Param("tickId") UUID tickId,
        @Param("finishedAt") Instant finishedAt,
        @Param("claimed") int claimed,
        @Param("sent") int sent,
        @Param("failed") int failed,
        @Param("skipped") int skipped,
        @Param("notes") String notes
    );
}
