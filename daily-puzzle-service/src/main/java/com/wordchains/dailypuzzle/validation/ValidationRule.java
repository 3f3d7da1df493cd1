package com.wordchains.dailypuzzle.validation;

/**
 * The closed set of candidate checks
 */
public enum ValidationRule {
    REQUIRED_FIELDS(ErrorKind.STRUCTURAL),
    DIFFICULTY(ErrorKind.STRUCTURAL),
    DUPLICATE_WORD(ErrorKind.STRUCTURAL),
    SINGLE_TOKEN(ErrorKind.STRUCTURAL),
    DUMMY_OVERLAPS_CHAIN(ErrorKind.STRUCTURAL),
    FUSED_PAIR_DUMMY(ErrorKind.LEAKAGE),
    LINK_FORM(ErrorKind.STRUCTURAL),
    BANNED_LINK(ErrorKind.COLLISION),
    WORD_REUSE(ErrorKind.COLLISION),
    BANNED_ENDPOINT(ErrorKind.COLLISION),
    TITLE_CASE(ErrorKind.STYLE);

    private final ErrorKind kind;

    ValidationRule(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
