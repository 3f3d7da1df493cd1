package com.wordchains.dailypuzzle.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Distribution of results for one puzzle: solves keyed by attempts ("1".."4") plus "loss"
 */
@Data
@Builder
public class PuzzleStats {
    private long puzzleId;
    private int total;
    private Map<String, Integer> counts;
}
