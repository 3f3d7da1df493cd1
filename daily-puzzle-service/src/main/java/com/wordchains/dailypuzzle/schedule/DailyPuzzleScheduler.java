package com.wordchains.dailypuzzle.schedule;

import com.wordchains.dailypuzzle.config.PuzzleProperties;
import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.store.LedgerInsert;
import com.wordchains.dailypuzzle.store.LedgerStore;
import com.wordchains.dailypuzzle.store.PoolStore;
import com.wordchains.dailypuzzle.validation.BannedSet;
import com.wordchains.rules.WordRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds exactly one pool puzzle to each date. Selection is a deterministic rotation of the
 * pool by day index, filtered by the similarity guard; the ledger's insert-if-absent decides
 * the winner between concurrent first requests. Holds no locks and no state.
 */
@Slf4j
@Service
public class DailyPuzzleScheduler {

    private final PoolStore poolStore;
    private final LedgerStore ledgerStore;
    private final RecencyTracker recencyTracker;
    private final PuzzleProperties properties;

    public DailyPuzzleScheduler(PoolStore poolStore,
                                LedgerStore ledgerStore,
                                RecencyTracker recencyTracker,
                                PuzzleProperties properties) {
        this.poolStore = poolStore;
        this.ledgerStore = ledgerStore;
        this.recencyTracker = recencyTracker;
        this.properties = properties;
    }

    /**
     * Get or create the assignment for a date, loading the pool only when needed.
     *
     * @return Empty when the date is unassigned and the pool has no puzzles
     */
    public Optional<AssignmentResult> assign(String dateKey) {
        String key = normalizeKey(dateKey);
        Optional<AssignmentResult> existing = existing(key);
        if (existing.isPresent()) {
            return existing;
        }
        return selectAndCommit(key, poolStore.listApprovedPuzzles());
    }

    /**
     * Get or create the assignment for a date from the given pool (ordered by id).
     */
    public Optional<AssignmentResult> assign(String dateKey, List<PuzzleEntry> pool) {
        String key = normalizeKey(dateKey);
        Optional<AssignmentResult> existing = existing(key);
        if (existing.isPresent()) {
            return existing;
        }
        return selectAndCommit(key, pool);
    }

    private Optional<AssignmentResult> existing(String dateKey) {
        return ledgerStore.getAssignment(dateKey)
                .map(puzzleId -> AssignmentResult.builder()
                        .dateKey(dateKey)
                        .puzzleId(puzzleId)
                        .usedFallback(false)
                        .newlyAssigned(false)
                        .build());
    }

    private Optional<AssignmentResult> selectAndCommit(String dateKey, List<PuzzleEntry> pool) {
        if (pool.isEmpty()) {
            log.warn("No puzzles in the pool, {} stays unassigned", dateKey);
            return Optional.empty();
        }

        long dayIndex = DayKeys.dayIndex(dateKey);
        BannedSet banned = recencyTracker.recentlyAssigned(dateKey, properties.getDaily().getWindowDays(), pool);
        List<PuzzleEntry> ordered = rotate(pool, dayIndex);

        PuzzleEntry selected = null;
        for (PuzzleEntry candidate : ordered) {
            if (!conflicts(candidate, banned)) {
                selected = candidate;
                break;
            }
        }

        boolean usedFallback = false;
        if (selected == null) {
            selected = ordered.get(0);
            usedFallback = true;
            log.warn("Similarity guard fallback for {}: every puzzle overlaps the last {} days, using {}",
                    dateKey, properties.getDaily().getWindowDays(), selected.getId());
        }

        LedgerInsert insert = ledgerStore.insertIfAbsent(dateKey, selected.getId());
        long committed = insert.getCommittedPuzzleId();
        if (!insert.isInserted()) {
            log.info("Assignment for {} already committed by another writer: {} (discarded {})",
                    dateKey, committed, selected.getId());
            return Optional.of(AssignmentResult.builder()
                    .dateKey(dateKey)
                    .puzzleId(committed)
                    .usedFallback(false)
                    .newlyAssigned(false)
                    .build());
        }

        log.info("Assigned puzzle {} to {}{}", committed, dateKey, usedFallback ? " (fallback)" : "");
        return Optional.of(AssignmentResult.builder()
                .dateKey(dateKey)
                .puzzleId(committed)
                .usedFallback(usedFallback)
                .newlyAssigned(true)
                .build());
    }

    /**
     * The pool starting at {@code pool[dayIndex mod size]} and wrapping around.
     */
    static <T> List<T> rotate(List<T> pool, long dayIndex) {
        int start = (int) Math.floorMod(dayIndex, (long) pool.size());
        List<T> ordered = new ArrayList<>(pool.subList(start, pool.size()));
        ordered.addAll(pool.subList(0, start));
        return ordered;
    }

    /**
     * Whether a puzzle shares a link or an endpoint with the banned set.
     */
    static boolean conflicts(PuzzleEntry puzzle, BannedSet banned) {
        for (String link : puzzle.links()) {
            if (banned.containsLink(WordRules.normalizeLink(link))) {
                return true;
            }
        }
        List<String> chain = puzzle.chainWords();
        return banned.containsEndpoint(WordRules.normalizeWord(chain.get(0)))
                || banned.containsEndpoint(WordRules.normalizeWord(chain.get(chain.size() - 1)));
    }

    // Reject malformed keys before touching the ledger
    private static String normalizeKey(String dateKey) {
        return DayKeys.toKey(DayKeys.parse(dateKey));
    }
}
