package com.wordchains.dailypuzzle.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DailyPuzzleView {
    private String dateKey;
    private PuzzleView puzzle;
    private boolean similarityGuardFallback;
}
