package com.wordchains.rules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization and lexical predicates shared by candidate validation, pool audits
 * and the daily similarity guard.
 */
public final class WordRules {

    // Unicode White_Space, so no-break and other non-ASCII spaces count as whitespace
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private WordRules() {
    }

    /**
     * Remove leading and trailing Unicode whitespace. Null becomes the empty string.
     */
    public static String strip(String value) {
        if (value == null) {
            return "";
        }
        return EDGE_WHITESPACE.matcher(value).replaceAll("");
    }

    /**
     * Trim and lowercase a word. Null becomes the empty string.
     */
    public static String normalizeWord(String word) {
        if (word == null) {
            return "";
        }
        return strip(word).toLowerCase(Locale.ROOT);
    }

    /**
     * Trim, lowercase and collapse internal whitespace runs to single spaces.
     * Null becomes the empty string.
     */
    public static String normalizeLink(String link) {
        if (link == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(strip(link).toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * A word is a single token when, once trimmed, it contains no whitespace and no hyphen.
     */
    public static boolean isSingleToken(String word) {
        if (word == null) {
            return false;
        }
        String trimmed = strip(word);
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c == '-' || Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                return false;
            }
        }
        return true;
    }

    /**
     * First character already in upper case form, the rest already in lower case form.
     * Proper nouns such as "McDonald" fail this check; callers report it as a warning only.
     */
    public static boolean isTitleCase(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        String head = word.substring(0, 1);
        String tail = word.substring(1);
        return head.equals(head.toUpperCase(Locale.ROOT))
                && tail.equals(tail.toLowerCase(Locale.ROOT));
    }

    /**
     * Compound form of two adjacent chain words, e.g. Key + Chain = "keychain".
     */
    public static String fusedPair(String left, String right) {
        return normalizeWord(left) + normalizeWord(right);
    }

    /**
     * Two-word phrase form of two adjacent chain words, e.g. Court + Case = "court case".
     */
    public static String phrasePair(String left, String right) {
        return normalizeWord(left) + " " + normalizeWord(right);
    }

    /**
     * Whether a link is the compound or the phrase form of the given pair.
     */
    public static boolean linkMatchesPair(String link, String left, String right) {
        String normalized = normalizeLink(link);
        return normalized.equals(fusedPair(left, right)) || normalized.equals(phrasePair(left, right));
    }
}
