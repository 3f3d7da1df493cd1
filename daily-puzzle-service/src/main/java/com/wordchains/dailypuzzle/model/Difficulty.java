package com.wordchains.dailypuzzle.model;

import java.util.Set;

/**
 * Difficulty labels a generated puzzle can carry
 */
public enum Difficulty {
    /**
     * Obvious compounds and collocations
     */
    EASY("Easy", "Obvious compounds and collocations"),

    /**
     * Mild abstraction, still very fair
     */
    MEDIUM("Medium", "Mild abstraction, still very fair"),

    /**
     * Layered linguistic or cultural reasoning, never obscure trivia
     */
    HARD("Hard", "Layered linguistic or cultural reasoning");

    // Color labels used by puzzles authored before the generator existed
    private static final Set<String> LEGACY_LABELS = Set.of("GREEN", "BLUE", "PURPLE");

    private final String title;
    private final String description;

    Difficulty(String title, String description) {
        this.title = title;
        this.description = description;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether a stored label is one the pool is expected to contain
     */
    public static boolean isKnownLabel(String label) {
        if (label == null) {
            return false;
        }
        if (LEGACY_LABELS.contains(label)) {
            return true;
        }
        for (Difficulty difficulty : values()) {
            if (difficulty.name().equals(label)) {
                return true;
            }
        }
        return false;
    }
}
