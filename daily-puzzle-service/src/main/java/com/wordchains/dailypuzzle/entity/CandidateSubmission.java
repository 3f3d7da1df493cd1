package com.wordchains.dailypuzzle.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A generated candidate that passed validation and was approved by a reviewer.
 * Publishing it to the pool happens outside this service.
 */
@Entity
@Table(name = "puzzle_candidates")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "difficulty", nullable = false, length = 20)
    private String difficulty;

    @Embedded
    private PuzzleWords words;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
