package com.wordchains.dailypuzzle.validation;

import java.util.List;

/**
 * Either a well-formed candidate or the reasons the generator payload could not be read.
 */
public final class CandidateParseResult {
    private final PuzzleCandidate candidate;
    private final List<String> errors;

    private CandidateParseResult(PuzzleCandidate candidate, List<String> errors) {
        this.candidate = candidate;
        this.errors = List.copyOf(errors);
    }

    public static CandidateParseResult ok(PuzzleCandidate candidate) {
        return new CandidateParseResult(candidate, List.of());
    }

    public static CandidateParseResult err(List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("An error result needs at least one reason");
        }
        return new CandidateParseResult(null, errors);
    }

    public static CandidateParseResult err(String error) {
        return err(List.of(error));
    }

    public boolean isOk() {
        return candidate != null;
    }

    public PuzzleCandidate getCandidate() {
        if (candidate == null) {
            throw new IllegalStateException("No candidate: " + String.join("; ", errors));
        }
        return candidate;
    }

    public List<String> getErrors() {
        return errors;
    }
}
