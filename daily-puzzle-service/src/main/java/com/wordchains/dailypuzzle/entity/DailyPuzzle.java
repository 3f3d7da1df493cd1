package com.wordchains.dailypuzzle.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Ledger row binding one civil date to one pool puzzle. Written at most once per date
 * and never updated.
 */
@Entity
@Table(name = "daily_puzzles")
@Data
@NoArgsConstructor
public class DailyPuzzle implements Persistable<String> {

    @Id
    @Column(name = "date_key", length = 10)
    private String dateKey;

    @Column(name = "puzzle_row_id", nullable = false)
    private Long puzzleRowId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Forces save() to persist rather than merge, so a duplicate date surfaces as a key violation
    @Transient
    private boolean persisted;

    public DailyPuzzle(String dateKey, Long puzzleRowId) {
        this.dateKey = dateKey;
        this.puzzleRowId = puzzleRowId;
    }

    @Override
    public String getId() {
        return dateKey;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        persisted = true;
    }
}
