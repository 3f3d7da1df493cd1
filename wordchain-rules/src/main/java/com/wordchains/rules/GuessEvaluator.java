package com.wordchains.rules;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a guess for the hidden middle of a chain.
 */
public class GuessEvaluator {

    /**
     * Evaluate a guess against the solution words.
     *
     * @param solution The hidden words in order
     * @param guess    The guessed words, same length as the solution
     * @return Colors per slot: green for the right word in the right slot, yellow for a word
     *         that belongs elsewhere (bounded by how often it still occurs), red otherwise
     */
    public GuessResult evaluate(List<String> solution, List<String> guess) {
        if (solution.size() != guess.size()) {
            throw new IllegalArgumentException("Guess must contain exactly " + solution.size() + " words");
        }

        List<TileColor> colors = new ArrayList<>();
        Map<String, Integer> remaining = new HashMap<>();
        for (String word : solution) {
            remaining.merge(word, 1, Integer::sum);
        }

        // Greens first so they consume their occurrences before any yellow does
        for (int i = 0; i < guess.size(); i++) {
            String word = guess.get(i);
            if (word != null && word.equals(solution.get(i))) {
                colors.add(TileColor.GREEN);
                remaining.merge(word, -1, Integer::sum);
            } else {
                colors.add(TileColor.RED);
            }
        }

        for (int i = 0; i < guess.size(); i++) {
            if (colors.get(i) == TileColor.GREEN) {
                continue;
            }
            String word = guess.get(i);
            if (remaining.getOrDefault(word, 0) > 0) {
                colors.set(i, TileColor.YELLOW);
                remaining.merge(word, -1, Integer::sum);
            }
        }

        return new GuessResult(colors);
    }
}
