package com.wordchains.dailypuzzle.validation;

import java.util.List;

/**
 * One itemized finding: the rule it breaks, a readable message and the offending values.
 */
public class ValidationError {
    private final ValidationRule rule;
    private final String message;
    private final List<String> values;

    public ValidationError(ValidationRule rule, String message, List<String> values) {
        this.rule = rule;
        this.message = message;
        this.values = List.copyOf(values);
    }

    public ValidationError(ValidationRule rule, String message) {
        this(rule, message, List.of());
    }

    public ValidationRule getRule() {
        return rule;
    }

    public ErrorKind getKind() {
        return rule.getKind();
    }

    public String getMessage() {
        return message;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return rule + ": " + message;
    }
}
