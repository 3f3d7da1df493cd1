package com.wordchains.dailypuzzle.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A published puzzle in the shared pool. Rows are immutable once created.
 */
@Entity
@Table(name = "puzzles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PuzzleEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "difficulty", length = 20)
    private String difficulty;

    @Embedded
    private PuzzleWords words;

    @Column(name = "created_at")
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public List<String> chainWords() {
        return words().chainWords();
    }

    public List<String> dummyWords() {
        return words().dummyWords();
    }

    public List<String> links() {
        return words().links();
    }

    // Hibernate leaves an embedded value null when every one of its columns is null
    private PuzzleWords words() {
        return words != null ? words : new PuzzleWords();
    }
}
