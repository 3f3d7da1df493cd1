package com.wordchains.rules;

/**
 * Feedback color for one guessed slot.
 */
public enum TileColor {
    BLANK(0),
    RED(1),
    YELLOW(2),
    GREEN(3);

    private final int rank;

    TileColor(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Keep the stronger of two colors, used to track the best feedback a bank word has received.
     */
    public TileColor upgrade(TileColor next) {
        return next.rank > rank ? next : this;
    }
}
