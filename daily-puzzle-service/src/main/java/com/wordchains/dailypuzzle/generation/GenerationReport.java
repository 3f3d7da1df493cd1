package com.wordchains.dailypuzzle.generation;

import com.wordchains.dailypuzzle.model.Difficulty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Summary of one generation batch
 */
@Data
@Builder
public class GenerationReport {
    private int approved;
    private int rejected;
    private List<Difficulty> failedSlots; // Slots whose retry budget ran out
    private boolean stoppedEarly;         // Reviewer quit before the plan finished
}
