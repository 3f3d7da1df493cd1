package com.wordchains.dailypuzzle.exception;

/**
 * The external generator failed to produce a candidate (transport failure, timeout,
 * empty response). Costs one attempt of the slot's retry budget.
 */
public class CandidateGenerationException extends RuntimeException {

    public CandidateGenerationException(String message) {
        super(message);
    }

    public CandidateGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
