package com.wordchains.dailypuzzle.generation;

import com.wordchains.dailypuzzle.model.Difficulty;
import com.wordchains.dailypuzzle.validation.BannedSet;

/**
 * External producer of puzzle candidates (typically a language model behind an HTTP API).
 * Its output is untrusted and always goes through parsing and validation.
 */
@FunctionalInterface
public interface CandidateGenerator {

    /**
     * Produce one candidate as a flat JSON object.
     *
     * @param difficulty The difficulty the slot needs
     * @param bannedSet  Links, endpoints and words to stay away from; escalated values are absolute
     * @return The raw JSON payload
     * @throws com.wordchains.dailypuzzle.exception.CandidateGenerationException when no candidate could be produced
     */
    String produceCandidate(Difficulty difficulty, BannedSet bannedSet);
}
