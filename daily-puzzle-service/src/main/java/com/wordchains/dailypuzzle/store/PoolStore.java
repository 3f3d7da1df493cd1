package com.wordchains.dailypuzzle.store;

import com.wordchains.dailypuzzle.entity.PuzzleEntry;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the published puzzle pool.
 */
public interface PoolStore {

    /**
     * All published puzzles, ordered by id ascending.
     */
    List<PuzzleEntry> listApprovedPuzzles();

    Optional<PuzzleEntry> findPuzzle(long id);
}
