package com.clapgrow.reminder.api.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "cron_runs", indexes = {
    @Index(name = "idx_cron_runs_started_at", columnList = "started_at")
})
@Getter
@Setter
@NoArgsConstructor
public class CronRun {

    @Id
    @Column(name = "tick_id")
    private UUID tickId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "claimed", nullable = false)
    private int claimed;

    @Column(name = "sent", nullable = false)
    private int sent;

    @Column(name = "failed", nullable = false)
    private int failed;

    @Column(name = "skipped", nullable = false)
    private int skipped;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    public CronRun(UUID tickId, Instant startedAt) {
        this.tickId = tickId;
        this.startedAt = startedAt;
    }
}
