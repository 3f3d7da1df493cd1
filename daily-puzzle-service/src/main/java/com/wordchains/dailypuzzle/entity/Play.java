package com.wordchains.dailypuzzle.entity;

import com.wordchains.dailypuzzle.model.PlayResult;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One player's result for one puzzle
 */
@Entity
@Table(name = "plays", uniqueConstraints = {
        @UniqueConstraint(name = "uk_plays_user_puzzle", columnNames = {"user_id", "puzzle_row_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Play {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Column(name = "puzzle_row_id", nullable = false)
    private Long puzzleRowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "result", nullable = false, length = 10)
    private PlayResult result;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Column(name = "local_date", length = 10)
    private String localDate;

    @Column(name = "played_at", nullable = false)
    private Instant playedAt;

    @PrePersist
    protected void onCreate() {
        if (playedAt == null) {
            playedAt = Instant.now();
        }
    }
}
