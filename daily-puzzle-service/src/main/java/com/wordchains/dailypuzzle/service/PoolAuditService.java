package com.wordchains.dailypuzzle.service;

import com.wordchains.dailypuzzle.dto.AuditReport;
import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.model.Difficulty;
import com.wordchains.dailypuzzle.store.PoolStore;
import com.wordchains.rules.WordRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-checks every published puzzle with the candidate rules. Structural problems are
 * errors; casing, link wording and labels are warnings since older rows predate them.
 */
@Slf4j
@Service
public class PoolAuditService {

    private final PoolStore poolStore;

    public PoolAuditService(PoolStore poolStore) {
        this.poolStore = poolStore;
    }

    public AuditReport audit() {
        List<PuzzleEntry> pool = poolStore.listApprovedPuzzles();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (PuzzleEntry entry : pool) {
            auditEntry(entry, errors, warnings);
        }

        if (errors.isEmpty()) {
            log.info("Checked {} puzzles, no blocking issues ({} warnings)", pool.size(), warnings.size());
        } else {
            log.warn("Checked {} puzzles, {} errors, {} warnings", pool.size(), errors.size(), warnings.size());
        }
        return AuditReport.builder()
                .checked(pool.size())
                .errors(errors)
                .warnings(warnings)
                .build();
    }

    void auditEntry(PuzzleEntry entry, List<String> errors, List<String> warnings) {
        String label = "Puzzle " + entry.getId();
        List<String> chain = entry.chainWords();
        List<String> dummies = entry.dummyWords();

        if (chain.stream().anyMatch(PoolAuditService::isBlank)) {
            errors.add(label + ": missing chain words.");
        }

        List<String> normalizedChain = normalizePresent(chain);
        Set<String> chainSet = new HashSet<>(normalizedChain);
        if (chainSet.size() != normalizedChain.size()) {
            errors.add(label + ": duplicate words in chain.");
        }

        List<String> normalizedDummies = normalizePresent(dummies);
        if (new HashSet<>(normalizedDummies).size() != normalizedDummies.size()) {
            errors.add(label + ": duplicate dummy words.");
        }

        checkWords(label, "chain", chain, errors, warnings);
        checkWords(label, "dummy", dummies, errors, warnings);

        Set<String> overlap = normalizedDummies.stream()
                .filter(chainSet::contains)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!overlap.isEmpty()) {
            errors.add(label + ": dummy words overlap chain (" + String.join(", ", overlap) + ").");
        }

        Set<String> fused = new HashSet<>();
        for (int i = 0; i < chain.size() - 1; i++) {
            if (!isBlank(chain.get(i)) && !isBlank(chain.get(i + 1))) {
                fused.add(WordRules.fusedPair(chain.get(i), chain.get(i + 1)));
            }
        }
        Set<String> fusedOverlap = normalizedDummies.stream()
                .filter(fused::contains)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!fusedOverlap.isEmpty()) {
            errors.add(label + ": dummy words match fused chain words (" + String.join(", ", fusedOverlap) + ").");
        }

        if (!Difficulty.isKnownLabel(entry.getDifficulty())) {
            warnings.add(label + ": unexpected difficulty \"" + entry.getDifficulty() + "\".");
        }

        checkLinks(label, chain, entry.links(), warnings);
    }

    private void checkWords(String label, String kind, List<String> words,
                            List<String> errors, List<String> warnings) {
        for (String word : words) {
            if (isBlank(word)) {
                continue;
            }
            if (!WordRules.isSingleToken(word)) {
                errors.add(label + ": " + kind + " word \"" + word + "\" is not a single word.");
            } else if (!WordRules.isTitleCase(WordRules.strip(word))) {
                warnings.add(label + ": " + kind + " word \"" + word + "\" is not Title Case.");
            }
        }
    }

    private void checkLinks(String label, List<String> chain, List<String> links, List<String> warnings) {
        for (int i = 0; i < links.size(); i++) {
            String link = links.get(i);
            String left = chain.get(i);
            String right = chain.get(i + 1);
            if (isBlank(link) || isBlank(left) || isBlank(right)) {
                continue;
            }
            String key = "qa_link_" + (i + 1);
            if (!WordRules.linkMatchesPair(link, left, right)) {
                warnings.add(label + ": " + key + " \"" + link + "\" does not match \"" + left + " " + right + "\".");
            }
            if (!link.equals(link.toLowerCase(Locale.ROOT))) {
                warnings.add(label + ": " + key + " is not lowercase.");
            }
            if (link.contains("-")) {
                warnings.add(label + ": " + key + " contains a hyphen.");
            }
        }
    }

    private static List<String> normalizePresent(List<String> words) {
        return words.stream()
                .filter(w -> !isBlank(w))
                .map(WordRules::normalizeWord)
                .collect(Collectors.toList());
    }

    private static boolean isBlank(String value) {
        return WordRules.strip(value).isEmpty();
    }
}
