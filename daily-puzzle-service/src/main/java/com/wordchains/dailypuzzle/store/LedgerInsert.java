package com.wordchains.dailypuzzle.store;

/**
 * Outcome of an insert-if-absent: the puzzle id stored for the date, and whether
 * this call's insert is the one that stored it.
 */
public final class LedgerInsert {
    private final long committedPuzzleId;
    private final boolean inserted;

    private LedgerInsert(long committedPuzzleId, boolean inserted) {
        this.committedPuzzleId = committedPuzzleId;
        this.inserted = inserted;
    }

    public static LedgerInsert inserted(long puzzleId) {
        return new LedgerInsert(puzzleId, true);
    }

    public static LedgerInsert alreadyAssigned(long committedPuzzleId) {
        return new LedgerInsert(committedPuzzleId, false);
    }

    public long getCommittedPuzzleId() {
        return committedPuzzleId;
    }

    public boolean isInserted() {
        return inserted;
    }

    @Override
    public String toString() {
        return "LedgerInsert{" + committedPuzzleId + (inserted ? ", inserted" : ", existing") + "}";
    }
}
