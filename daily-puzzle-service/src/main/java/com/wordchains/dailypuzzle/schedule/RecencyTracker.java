package com.wordchains.dailypuzzle.schedule;

import com.wordchains.dailypuzzle.config.PuzzleProperties;
import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.store.LedgerStore;
import com.wordchains.dailypuzzle.validation.BannedSet;
import com.wordchains.rules.WordRules;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Derives banned sets from recent history, either from pool creation times
 * (generation) or from the daily ledger (scheduling).
 */
@Component
public class RecencyTracker {

    private final LedgerStore ledgerStore;
    private final PuzzleProperties properties;

    public RecencyTracker(LedgerStore ledgerStore, PuzzleProperties properties) {
        this.ledgerStore = ledgerStore;
        this.properties = properties;
    }

    /**
     * Banned set from pool rows created in {@code [now - windowDays, now)}.
     */
    public BannedSet recentlyCreated(List<PuzzleEntry> pool, int windowDays, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(windowDays));
        List<PuzzleEntry> recent = pool.stream()
                .filter(p -> p.getCreatedAt() != null)
                .filter(p -> !p.getCreatedAt().isBefore(cutoff) && p.getCreatedAt().isBefore(now))
                .collect(Collectors.toList());
        return collect(recent);
    }

    /**
     * Banned set from the puzzles assigned to the {@code windowDays} dates before {@code dateKey}.
     * Ledger rows pointing at puzzles missing from the pool are skipped.
     */
    public BannedSet recentlyAssigned(String dateKey, int windowDays, List<PuzzleEntry> pool) {
        Map<String, Long> assignments = ledgerStore.findAssignments(DayKeys.recentDateKeys(dateKey, windowDays));
        Set<Long> recentIds = new HashSet<>(assignments.values());
        List<PuzzleEntry> recent = pool.stream()
                .filter(p -> recentIds.contains(p.getId()))
                .collect(Collectors.toList());
        return collect(recent);
    }

    BannedSet collect(Collection<PuzzleEntry> entries) {
        Set<String> links = new TreeSet<>();
        Set<String> endpoints = new TreeSet<>();
        Set<String> words = new TreeSet<>();

        for (PuzzleEntry entry : entries) {
            for (String link : entry.links()) {
                addIfPresent(links, WordRules.normalizeLink(link));
            }
            List<String> chain = entry.chainWords();
            addIfPresent(endpoints, WordRules.normalizeWord(chain.get(0)));
            addIfPresent(endpoints, WordRules.normalizeWord(chain.get(chain.size() - 1)));
            for (String word : chain) {
                addIfPresent(words, WordRules.normalizeWord(word));
            }
        }

        // Words are only a soft sample; links and endpoints stay complete
        Set<String> sample = words.stream()
                .limit(properties.getGeneration().getAvoidWordSample())
                .collect(Collectors.toCollection(TreeSet::new));
        return BannedSet.of(links, endpoints, sample);
    }

    private static void addIfPresent(Set<String> target, String normalized) {
        if (!normalized.isEmpty()) {
            target.add(normalized);
        }
    }
}
