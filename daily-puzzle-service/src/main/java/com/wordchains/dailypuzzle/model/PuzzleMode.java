package com.wordchains.dailypuzzle.model;

/**
 * How a puzzle was reached by the player
 */
public enum PuzzleMode {
    DAILY,
    ARCHIVE,
    ENDLESS
}
