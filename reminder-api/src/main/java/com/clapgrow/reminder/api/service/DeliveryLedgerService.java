package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.api.entity.ReminderDelivery;
import com.clapgrow.reminder.api.repository.ReminderDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Idempotency ledger: one record per (reminder, occurrence).
 *
 * A successful record for an occurrence means the message went out; the tick then
 * only advances the reminder instead of sending again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryLedgerService {

    private static final DateTimeFormatter OCCURRENCE_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final ReminderDeliveryRepository reminderDeliveryRepository;
    private final Clock clock;

    /**
     * Key of one occurrence, e.g. {@code 6f1c...:2024-06-03T05:30:00.000Z}.
     */
    public static String deliveryKey(UUID reminderId, Instant occurrence) {
        return reminderId + ":" + OCCURRENCE_FORMAT.format(occurrence);
    }

    public boolean hasSucceeded(UUID reminderId, String deliveryKey) {
        return reminderDeliveryRepository.findByReminderIdAndDeliveryKey(reminderId, deliveryKey)
            .map(ReminderDelivery::isOk)
            .orElse(false);
    }

    /**
     * Insert the outcome of an attempt, overwriting an earlier failed record for the same
     * occurrence. A successful record is kept.
     */
    public void record(UUID reminderId, String deliveryKey, UUID tickId, boolean ok, String error) {
        reminderDeliveryRepository.upsert(reminderId, deliveryKey, tickId, ok, error, clock.instant());
        log.debug("Recorded delivery: reminderId={}, deliveryKey={}, ok={}", reminderId, deliveryKey, ok);
    }
}
