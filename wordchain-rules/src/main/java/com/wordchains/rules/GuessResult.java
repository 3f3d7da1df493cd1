package com.wordchains.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-slot colors of one evaluated guess.
 */
public class GuessResult {
    private final List<TileColor> colors;

    public GuessResult(List<TileColor> colors) {
        this.colors = new ArrayList<>(colors);
    }

    public List<TileColor> getColors() {
        return new ArrayList<>(colors);
    }

    public boolean isAllGreen() {
        return colors.stream().allMatch(c -> c == TileColor.GREEN);
    }

    @Override
    public String toString() {
        return colors.toString();
    }
}
