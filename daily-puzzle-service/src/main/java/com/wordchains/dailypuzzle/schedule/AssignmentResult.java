package com.wordchains.dailypuzzle.schedule;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AssignmentResult {
    private String dateKey;
    private long puzzleId;
    private boolean usedFallback;   // Similarity guard found nothing clean; first rotated entry was used
    private boolean newlyAssigned;  // This call's insert created the ledger row
}
