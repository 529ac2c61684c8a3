package com.clapgrow.reminder.api.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * created_at / updated_at columns shared by the reminder tables.
 *
 * Bulk updates issued through native queries maintain updated_at themselves.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class BaseTimestampedEntity {

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
