package com.clapgrow.reminder.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Bot user owning reminders. Only the columns the delivery path reads are mapped.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
public class AppUser extends BaseTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    /**
     * Private chat id with the bot.
     */
    @Column(name = "telegram_id", nullable = false, unique = true)
    private String telegramId;

    @Column(name = "username")
    private String username;

    @Column(name = "timezone", nullable = false)
    private String timezone = "Asia/Tehran";
}
