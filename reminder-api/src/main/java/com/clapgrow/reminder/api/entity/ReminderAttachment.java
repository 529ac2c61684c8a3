package com.clapgrow.reminder.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Rich content attached to a reminder, stored as a message in an archive chat.
 */
@Entity
@Table(name = "reminders_attachments", indexes = {
    @Index(name = "idx_reminders_attachments_reminder_created", columnList = "reminder_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class ReminderAttachment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "reminder_id", nullable = false)
    private UUID reminderId;

    @Column(name = "archive_chat_id", nullable = false)
    private Long archiveChatId;

    @Column(name = "archive_message_id", nullable = false)
    private Long archiveMessageId;

    @Column(name = "kind", nullable = false)
    private String kind;

    @Column(name = "caption", columnDefinition = "TEXT")
    private String caption;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
