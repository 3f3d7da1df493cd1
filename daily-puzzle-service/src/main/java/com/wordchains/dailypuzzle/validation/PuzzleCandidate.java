package com.wordchains.dailypuzzle.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A machine-generated puzzle awaiting validation. Slots may be null when the
 * generator left a field out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PuzzleCandidate {
    private String difficulty;
    private List<String> chain;   // 8 words, word_1..word_8
    private List<String> dummies; // 10 distractors
    private List<String> links;   // 7 links, links[i] joins chain[i] and chain[i + 1]
}
