package com.clapgrow.reminder.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one delivery attempt for one occurrence of a reminder.
 *
 * At most one row per (reminder_id, delivery_key); a later attempt overwrites it.
 */
@Entity
@Table(name = "reminder_deliveries", uniqueConstraints = {
    @UniqueConstraint(name = "uniq_reminder_delivery_key", columnNames = {"reminder_id", "delivery_key"})
})
@Getter
@Setter
@NoArgsConstructor
public class ReminderDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "reminder_id", nullable = false)
    private UUID reminderId;

    @Column(name = "tick_id", nullable = false)
    private UUID tickId;

    @Column(name = "sent_at_utc", nullable = false)
    private Instant sentAtUtc;

    @Column(name = "delivery_key", nullable = false, columnDefinition = "TEXT")
    private String deliveryKey;

    @Column(name = "ok", nullable = false)
    private boolean ok;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;
}
