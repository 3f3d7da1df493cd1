package com.wordchains.dailypuzzle.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Next endless-mode puzzle. A null puzzle means the player has finished the pool.
 */
@Data
@AllArgsConstructor
public class NextPuzzle {
    private PuzzleView puzzle;
    private boolean hasNext;

    public static NextPuzzle exhausted() {
        return new NextPuzzle(null, false);
    }
}
