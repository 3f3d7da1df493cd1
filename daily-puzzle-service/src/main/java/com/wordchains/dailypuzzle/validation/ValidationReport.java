package com.wordchains.dailypuzzle.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating one candidate. The candidate is accepted when there are no errors;
 * warnings never block.
 */
public class ValidationReport {
    private final List<ValidationError> errors;
    private final List<ValidationError> warnings;

    public ValidationReport(List<ValidationError> errors, List<ValidationError> warnings) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public List<ValidationError> getWarnings() {
        return warnings;
    }

    public boolean isAccepted() {
        return errors.isEmpty();
    }

    public boolean hasError(ValidationRule rule) {
        return errors.stream().anyMatch(e -> e.getRule() == rule);
    }

    /**
     * Links that collided with the banned set, to be hard-blocked on the next attempt
     */
    public List<String> bannedLinkConflicts() {
        return valuesOf(ValidationRule.BANNED_LINK);
    }

    /**
     * Endpoints that collided with the banned set, to be hard-blocked on the next attempt
     */
    public List<String> bannedEndpointConflicts() {
        return valuesOf(ValidationRule.BANNED_ENDPOINT);
    }

    public String summary() {
        return errors.stream().map(ValidationError::getMessage).collect(Collectors.joining("; "));
    }

    private List<String> valuesOf(ValidationRule rule) {
        return errors.stream()
                .filter(e -> e.getRule() == rule)
                .flatMap(e -> e.getValues().stream())
                .distinct()
                .collect(Collectors.toList());
    }
}
