package com.wordchains.dailypuzzle.validation;

import com.wordchains.dailypuzzle.model.Difficulty;
import com.wordchains.rules.WordRules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enforces the structural, lexical and anti-collision rules on a generated candidate.
 * Stateless; every failure is reported as a value, never thrown.
 */
public class CandidateValidator {

    public static final int CHAIN_LENGTH = 8;
    public static final int DUMMY_COUNT = 10;
    public static final int LINK_COUNT = CHAIN_LENGTH - 1;

    private final boolean hardBlockEndpoints;

    public CandidateValidator(boolean hardBlockEndpoints) {
        this.hardBlockEndpoints = hardBlockEndpoints;
    }

    public boolean isHardBlockEndpoints() {
        return hardBlockEndpoints;
    }

    /**
     * Validate a candidate.
     *
     * @param candidate   The candidate to check
     * @param expected    The difficulty the slot asked for
     * @param banned      Recent history plus same-run exclusions
     * @param reuseBudget How many chain words may appear in the banned word sample
     * @return Itemized errors (empty when accepted) and Title Case warnings
     */
    public ValidationReport validate(PuzzleCandidate candidate, Difficulty expected,
                                     BannedSet banned, int reuseBudget) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();

        List<String> missing = missingFields(candidate);
        if (!missing.isEmpty()) {
            errors.add(new ValidationError(ValidationRule.REQUIRED_FIELDS,
                    "Missing " + String.join(", ", missing) + ".", missing));
            return new ValidationReport(errors, warnings);
        }

        if (!expected.name().equals(candidate.getDifficulty())) {
            errors.add(new ValidationError(ValidationRule.DIFFICULTY,
                    "Difficulty is " + candidate.getDifficulty() + ", expected " + expected + ".",
                    List.of(candidate.getDifficulty())));
        }

        List<String> chain = candidate.getChain();
        List<String> dummies = candidate.getDummies();
        List<String> normalizedChain = normalizeAll(chain);
        List<String> normalizedDummies = normalizeAll(dummies);

        checkDuplicates(normalizedChain, normalizedDummies, errors);
        checkTokens(chain, "Chain", errors, warnings);
        checkTokens(dummies, "Dummy", errors, warnings);
        checkDummyLeaks(chain, normalizedChain, normalizedDummies, errors);
        checkLinks(chain, candidate.getLinks(), errors);
        checkHistory(candidate.getLinks(), normalizedChain, banned, reuseBudget, errors);

        return new ValidationReport(errors, warnings);
    }

    private List<String> missingFields(PuzzleCandidate candidate) {
        List<String> missing = new ArrayList<>();
        if (isBlank(candidate.getDifficulty())) {
            missing.add("difficulty");
        }
        missing.addAll(missingSlots(candidate.getChain(), CHAIN_LENGTH, "word_"));
        missing.addAll(missingSlots(candidate.getDummies(), DUMMY_COUNT, "dummy_"));
        missing.addAll(missingSlots(candidate.getLinks(), LINK_COUNT, "qa_link_"));
        return missing;
    }

    private List<String> missingSlots(List<String> values, int expectedSize, String keyPrefix) {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < expectedSize; i++) {
            if (values == null || i >= values.size() || isBlank(values.get(i))) {
                missing.add(keyPrefix + (i + 1));
            }
        }
        if (values != null && values.size() > expectedSize) {
            missing.add(keyPrefix + "* (expected " + expectedSize + ", got " + values.size() + ")");
        }
        return missing;
    }

    // Rule: no normalized word may appear twice across chain and dummies
    private void checkDuplicates(List<String> normalizedChain, List<String> normalizedDummies,
                                 List<ValidationError> errors) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        List<String> all = new ArrayList<>(normalizedChain);
        all.addAll(normalizedDummies);
        for (String word : all) {
            if (!seen.add(word)) {
                duplicates.add(word);
            }
        }
        for (String word : duplicates) {
            errors.add(new ValidationError(ValidationRule.DUPLICATE_WORD,
                    "Duplicate word \"" + word + "\".", List.of(word)));
        }
    }

    private void checkTokens(List<String> words, String label,
                             List<ValidationError> errors, List<ValidationError> warnings) {
        for (String word : words) {
            if (!WordRules.isSingleToken(word)) {
                errors.add(new ValidationError(ValidationRule.SINGLE_TOKEN,
                        label + " word \"" + word + "\" not single word.", List.of(word)));
            } else if (!WordRules.isTitleCase(WordRules.strip(word))) {
                warnings.add(new ValidationError(ValidationRule.TITLE_CASE,
                        label + " word \"" + word + "\" not Title Case.", List.of(word)));
            }
        }
    }

    private void checkDummyLeaks(List<String> chain, List<String> normalizedChain,
                                 List<String> normalizedDummies, List<ValidationError> errors) {
        Set<String> chainSet = new HashSet<>(normalizedChain);
        List<String> overlap = normalizedDummies.stream()
                .filter(chainSet::contains)
                .collect(Collectors.toList());
        if (!overlap.isEmpty()) {
            errors.add(new ValidationError(ValidationRule.DUMMY_OVERLAPS_CHAIN,
                    "Dummy words overlap chain (" + String.join(", ", overlap) + ").", overlap));
        }

        Set<String> fused = new HashSet<>();
        for (int i = 0; i < chain.size() - 1; i++) {
            fused.add(WordRules.fusedPair(chain.get(i), chain.get(i + 1)));
        }
        List<String> leaks = normalizedDummies.stream()
                .filter(fused::contains)
                .collect(Collectors.toList());
        if (!leaks.isEmpty()) {
            errors.add(new ValidationError(ValidationRule.FUSED_PAIR_DUMMY,
                    "Dummy words match fused pairs (" + String.join(", ", leaks) + ").", leaks));
        }
    }

    private void checkLinks(List<String> chain, List<String> links, List<ValidationError> errors) {
        for (int i = 0; i < LINK_COUNT; i++) {
            String link = links.get(i);
            String key = "qa_link_" + (i + 1);
            if (link.contains("-")) {
                errors.add(new ValidationError(ValidationRule.LINK_FORM,
                        key + " has hyphen.", List.of(link)));
            }
            if (!link.equals(link.toLowerCase(Locale.ROOT))) {
                errors.add(new ValidationError(ValidationRule.LINK_FORM,
                        key + " not lowercase.", List.of(link)));
            }
            if (!WordRules.linkMatchesPair(link, chain.get(i), chain.get(i + 1))) {
                errors.add(new ValidationError(ValidationRule.LINK_FORM,
                        key + " does not match \"" + WordRules.phrasePair(chain.get(i), chain.get(i + 1)) + "\".",
                        List.of(link)));
            }
        }
    }

    private void checkHistory(List<String> links, List<String> normalizedChain, BannedSet banned,
                              int reuseBudget, List<ValidationError> errors) {
        List<String> linkConflicts = links.stream()
                .map(WordRules::normalizeLink)
                .filter(banned::containsLink)
                .distinct()
                .collect(Collectors.toList());
        if (!linkConflicts.isEmpty()) {
            errors.add(new ValidationError(ValidationRule.BANNED_LINK,
                    "qa_links already used (" + String.join(", ", linkConflicts) + ").", linkConflicts));
        }

        List<String> reused = normalizedChain.stream()
                .filter(banned::containsWord)
                .collect(Collectors.toList());
        if (reused.size() > reuseBudget) {
            errors.add(new ValidationError(ValidationRule.WORD_REUSE,
                    "Too many reused words (" + String.join(", ", reused) + ").", reused));
        }

        if (hardBlockEndpoints) {
            List<String> endpointConflicts = List.of(normalizedChain.get(0), normalizedChain.get(CHAIN_LENGTH - 1))
                    .stream()
                    .filter(banned::containsEndpoint)
                    .distinct()
                    .collect(Collectors.toList());
            if (!endpointConflicts.isEmpty()) {
                errors.add(new ValidationError(ValidationRule.BANNED_ENDPOINT,
                        "Endpoints already used (" + String.join(", ", endpointConflicts) + ").",
                        endpointConflicts));
            }
        }
    }

    private static List<String> normalizeAll(List<String> words) {
        return words.stream().map(WordRules::normalizeWord).collect(Collectors.toList());
    }

    private static boolean isBlank(String value) {
        return WordRules.strip(value).isEmpty();
    }
}
