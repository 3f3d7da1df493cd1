package com.wordchains.dailypuzzle.dto;

import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.model.PuzzleMode;
import com.wordchains.rules.SeededShuffle;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A puzzle as shown to the player. Links stay server-side.
 */
@Data
@Builder
public class PuzzleView {
    private long id;
    private long puzzleNumber; // Day number for daily puzzles when a launch date is set, else the id
    private PuzzleMode mode;
    private String difficulty;
    private List<String> words;      // All 8 chain words; the client hides 2..7
    private List<String> dummyWords;
    private List<String> wordBank;   // Hidden chain words and dummies in a per-puzzle stable order

    public static PuzzleView from(PuzzleEntry entry, PuzzleMode mode, long puzzleNumber) {
        List<String> chain = entry.chainWords();
        List<String> bank = new ArrayList<>(chain.subList(1, chain.size() - 1));
        bank.addAll(entry.dummyWords());

        return PuzzleView.builder()
                .id(entry.getId())
                .puzzleNumber(puzzleNumber)
                .mode(mode)
                .difficulty(entry.getDifficulty())
                .words(chain)
                .dummyWords(entry.dummyWords())
                .wordBank(SeededShuffle.shuffle(bank, String.valueOf(entry.getId())))
                .build();
    }
}
