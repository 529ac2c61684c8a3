package com.clapgrow.reminder.api.repository;

import com.clapgrow.reminder.api.entity.ReminderDelivery;
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
public interface ReminderDeliveryRepository extends JpaRepository<ReminderDelivery, UUID> {

    Optional<ReminderDelivery> findByReminderIdAndDeliveryKey(UUID reminderId, String deliveryKey);

    /**
     * Insert or overwrite the delivery record of one occurrence. A successful record is
     * never overwritten.
     *
     * @return Number of rows written (0 when a successful record already exists)
     */
    @Transactional
    @Modifying
    @Query(value = "INSERT INTO reminder_deliveries (reminder_id, delivery_key, tick_id, ok, error, sent_at_utc) "
        + "VALUES (:reminderId, :deliveryKey, :tickId, :ok, :error, :sentAt) "
        + "ON CONFLICT (reminder_id, delivery_key) DO UPDATE SET "
        + "tick_id = EXCLUDED.tick_id, ok = EXCLUDED.ok, error = EXCLUDED.error, sent_at_utc = EXCLUDED.sent_at_utc "
        + "WHERE reminder_deliveries.ok = FALSE",
        nativeQuery = true)
    int upsert(
        @Param("reminderId") UUID reminderId,
        @Param("deliveryKey") String deliveryKey,
        @Param("tickId") UUID tickId,
        @Param("ok") boolean ok,
        @Param("error") String error,
        @Param("sentAt") Instant sentAt
    );
}
