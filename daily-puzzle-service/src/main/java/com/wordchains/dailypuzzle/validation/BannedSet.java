package com.wordchains.dailypuzzle.validation;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalized links, endpoints and words excluded because of recent use.
 *
 * <p>Links and endpoints are hard constraints. Words are a soft sample used for the
 * reuse budget. Values added through {@link #escalate} are also kept apart so a
 * generator can stress them as absolute blocks on its next attempt.</p>
 */
public final class BannedSet {

    private static final BannedSet EMPTY = new BannedSet(Set.of(), Set.of(), Set.of(), Set.of(), Set.of());

    private final Set<String> links;
    private final Set<String> endpoints;
    private final Set<String> words;
    private final Set<String> escalatedLinks;
    private final Set<String> escalatedEndpoints;

    private BannedSet(Collection<String> links, Collection<String> endpoints, Collection<String> words,
                      Collection<String> escalatedLinks, Collection<String> escalatedEndpoints) {
        this.links = sorted(links);
        this.endpoints = sorted(endpoints);
        this.words = sorted(words);
        this.escalatedLinks = sorted(escalatedLinks);
        this.escalatedEndpoints = sorted(escalatedEndpoints);
    }

    public static BannedSet empty() {
        return EMPTY;
    }

    public static BannedSet of(Collection<String> links, Collection<String> endpoints, Collection<String> words) {
        return new BannedSet(links, endpoints, words, Set.of(), Set.of());
    }

    public BannedSet union(BannedSet other) {
        return new BannedSet(
                merge(links, other.links),
                merge(endpoints, other.endpoints),
                merge(words, other.words),
                merge(escalatedLinks, other.escalatedLinks),
                merge(escalatedEndpoints, other.escalatedEndpoints));
    }

    /**
     * Fold conflicts reported by a failed attempt into the set used for the next one.
     */
    public BannedSet escalate(Collection<String> conflictingLinks, Collection<String> conflictingEndpoints) {
        return new BannedSet(
                merge(links, conflictingLinks),
                merge(endpoints, conflictingEndpoints),
                words,
                merge(escalatedLinks, conflictingLinks),
                merge(escalatedEndpoints, conflictingEndpoints));
    }

    public boolean containsLink(String normalizedLink) {
        return links.contains(normalizedLink);
    }

    public boolean containsEndpoint(String normalizedWord) {
        return endpoints.contains(normalizedWord);
    }

    public boolean containsWord(String normalizedWord) {
        return words.contains(normalizedWord);
    }

    public Set<String> getLinks() {
        return links;
    }

    public Set<String> getEndpoints() {
        return endpoints;
    }

    public Set<String> getWords() {
        return words;
    }

    public Set<String> getEscalatedLinks() {
        return escalatedLinks;
    }

    public Set<String> getEscalatedEndpoints() {
        return escalatedEndpoints;
    }

    @Override
    public String toString() {
        return "BannedSet{links=" + links.size()
                + ", endpoints=" + endpoints.size()
                + ", words=" + words.size()
                + ", escalated=" + (escalatedLinks.size() + escalatedEndpoints.size()) + "}";
    }

    private static Set<String> merge(Collection<String> left, Collection<String> right) {
        Set<String> merged = new TreeSet<>(left);
        merged.addAll(right);
        return merged;
    }

    private static Set<String> sorted(Collection<String> values) {
        return Collections.unmodifiableSet(new TreeSet<>(values));
    }
}
