package com.wordchains.dailypuzzle.validation;

/**
 * How a validation finding is treated by the generation loop
 */
public enum ErrorKind {
    /**
     * Missing or malformed content. Fatal to the candidate.
     */
    STRUCTURAL,

    /**
     * Conflict with recent history. Fatal to the candidate, escalated into the next attempt.
     */
    COLLISION,

    /**
     * A distractor gives away an adjacent link. Treated like a collision.
     */
    LEAKAGE,

    /**
     * Casing deviations. Reported, never blocking.
     */
    STYLE
}
