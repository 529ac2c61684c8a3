package com.clapgrow.reminder.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Archive channel post mirroring an entity (here: a reminder) together with the
 * message ids of its content, in the order they were archived.
 */
@Entity
@Table(name = "archive_items", indexes = {
    @Index(name = "idx_archive_items_kind_entity", columnList = "kind, entity_id")
})
@Getter
@Setter
@NoArgsConstructor
public class ArchiveItem extends BaseTimestampedEntity {

    public static final String KIND_REMINDER = "reminder";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "owner_user_id", nullable = false)
    private UUID ownerUserId;

    @Column(name = "kind", nullable = false)
    private String kind;

    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "message_ids", nullable = false, columnDefinition = "jsonb")
    private List<Long> messageIds = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "meta", nullable = false, columnDefinition = "jsonb")
    private ArchiveItemMeta meta = new ArchiveItemMeta();

    @Column(name = "status", nullable = false)
    private String status = "active";

    @Column(name = "status_note", columnDefinition = "TEXT")
    private String statusNote;
}
