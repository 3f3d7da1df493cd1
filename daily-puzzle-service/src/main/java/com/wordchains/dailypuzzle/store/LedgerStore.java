package com.wordchains.dailypuzzle.store;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * The date to puzzle ledger. Implementations must make {@link #insertIfAbsent} atomic:
 * the storage layer's uniqueness on the date key is the only arbiter between concurrent writers.
 */
public interface LedgerStore {

    Optional<Long> getAssignment(String dateKey);

    /**
     * Store the assignment unless the date already has one.
     *
     * @return The puzzle id actually committed for the date, which is another writer's
     *         choice when that writer got there first, and whether this call inserted it
     */
    LedgerInsert insertIfAbsent(String dateKey, long puzzleId);

    /**
     * Committed assignments for whichever of the given dates have one.
     */
    Map<String, Long> findAssignments(Collection<String> dateKeys);
}
