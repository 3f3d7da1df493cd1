package com.wordchains.dailypuzzle.generation;

import com.wordchains.dailypuzzle.validation.PuzzleCandidate;

/**
 * Final say on a candidate that passed validation, usually a human editor.
 */
@FunctionalInterface
public interface CandidateReviewer {

    ReviewDecision review(PuzzleCandidate candidate);

    static CandidateReviewer approveAll() {
        return candidate -> ReviewDecision.APPROVE;
    }
}
