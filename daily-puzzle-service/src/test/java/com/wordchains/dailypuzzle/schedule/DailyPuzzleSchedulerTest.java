package com.wordchains.dailypuzzle.schedule;

import com.wordchains.dailypuzzle.config.PuzzleProperties;
import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.store.LedgerInsert;
import com.wordchains.dailypuzzle.store.LedgerStore;
import com.wordchains.dailypuzzle.store.PoolStore;
import com.wordchains.dailypuzzle.support.InMemoryLedgerStore;
import com.wordchains.dailypuzzle.support.InMemoryPoolStore;
import com.wordchains.dailypuzzle.support.Puzzles;
import com.wordchains.dailypuzzle.validation.BannedSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DailyPuzzleSchedulerTest {

    // dayIndex("2024-03-01") = 19783, so a pool of 10 starts its rotation at index 3
    private static final String DATE = "2024-03-01";

    private PuzzleProperties properties;
    private InMemoryLedgerStore ledger;
    private List<PuzzleEntry> pool;

    @BeforeEach
    void setUp() {
        properties = new PuzzleProperties();
        ledger = new InMemoryLedgerStore();
        pool = new ArrayList<>();
        String[] prefixes = {"Pa", "Pb", "Pc", "Pd", "Pe", "Pf", "Pg", "Ph", "Pi", "Pj"};
        for (int i = 0; i < prefixes.length; i++) {
            pool.add(Puzzles.entry((long) (i + 1), prefixes[i]));
        }
    }

    private DailyPuzzleScheduler scheduler(PoolStore poolStore, LedgerStore ledgerStore) {
        return new DailyPuzzleScheduler(poolStore, ledgerStore,
                new RecencyTracker(ledgerStore, properties), properties);
    }

    private DailyPuzzleScheduler scheduler() {
        return scheduler(new InMemoryPoolStore(pool), ledger);
    }

    @Test
    void testRotationStartsAtDayIndex() {
        AssignmentResult result = scheduler().assign(DATE).orElseThrow();

        assertEquals(4, result.getPuzzleId());
        assertFalse(result.isUsedFallback());
        assertTrue(result.isNewlyAssigned());
        assertEquals(Map.of(DATE, 4L), ledger.rows());
    }

    @Test
    void testSimilarityGuardSkipsOverlappingPuzzle() {
        // pool[3] reuses a link of pool[0], which was the puzzle of 2024-02-20
        pool.get(3).getWords().setQaLink3(pool.get(0).links().get(2));
        ledger.with("2024-02-20", 1);

        AssignmentResult result = scheduler().assign(DATE).orElseThrow();

        assertEquals(5, result.getPuzzleId());
        assertFalse(result.isUsedFallback());
        assertEquals(5L, ledger.rows().get(DATE));
    }

    @Test
    void testConflictIgnoresNonAsciiSpacing() {
        PuzzleEntry previous = Puzzles.entry(1L, Puzzles.KEY_CHAIN, Puzzles.KEY_CHAIN_DUMMIES,
                Puzzles.KEY_CHAIN_LINKS, null);
        PuzzleEntry candidate = Puzzles.entry(2L, "Qa");
        candidate.getWords().setQaLink4("time\u00A0zone");
        BannedSet banned = new RecencyTracker(ledger, properties).collect(List.of(previous));

        assertTrue(DailyPuzzleScheduler.conflicts(candidate, banned));
    }

    @Test
    void testSharedEndpointAlsoConflicts() {
        pool.get(3).getWords().setWord8(pool.get(0).chainWords().get(0));
        ledger.with("2024-02-20", 1);

        assertEquals(5, scheduler().assign(DATE).orElseThrow().getPuzzleId());
    }

    @Test
    void testFallbackWhenEverythingConflicts() {
        List<PuzzleEntry> small = List.of(pool.get(0), pool.get(1));
        ledger.with("2024-02-29", 1).with("2024-02-28", 2);

        // 19783 mod 2 = 1, so the rotation is [2, 1]
        AssignmentResult result = scheduler(new InMemoryPoolStore(small), ledger).assign(DATE).orElseThrow();

        assertEquals(2, result.getPuzzleId());
        assertTrue(result.isUsedFallback());
        assertEquals(2L, ledger.rows().get(DATE));
    }

    @Test
    void testHistoryOutsideWindowIgnored() {
        // 2024-01-30 is 31 days before 2024-03-01
        ledger.with("2024-01-30", 4);

        AssignmentResult result = scheduler().assign(DATE).orElseThrow();

        assertEquals(4, result.getPuzzleId());
        assertFalse(result.isUsedFallback());
    }

    @Test
    void testWindowIsConfigurable() {
        ledger.with("2024-02-25", 4);
        properties.getDaily().setWindowDays(3);

        assertEquals(4, scheduler().assign(DATE).orElseThrow().getPuzzleId());
    }

    @Test
    void testExistingAssignmentSkipsPoolLoad() {
        PoolStore poolStore = mock(PoolStore.class);
        ledger.with(DATE, 42);

        AssignmentResult result = scheduler(poolStore, ledger).assign(DATE).orElseThrow();

        assertEquals(42, result.getPuzzleId());
        assertFalse(result.isNewlyAssigned());
        assertEquals(0, ledger.insertCalls());
        verifyNoInteractions(poolStore);
    }

    @Test
    void testRepeatedCallsReturnSameAssignment() {
        DailyPuzzleScheduler scheduler = scheduler();

        AssignmentResult first = scheduler.assign(DATE).orElseThrow();
        pool.add(0, Puzzles.entry(0L, "Pz"));
        AssignmentResult second = scheduler.assign(DATE).orElseThrow();

        assertEquals(first.getPuzzleId(), second.getPuzzleId());
        assertTrue(first.isNewlyAssigned());
        assertFalse(second.isNewlyAssigned());
    }

    @Test
    void testLosingTheRaceReturnsCommittedValue() {
        LedgerStore racing = mock(LedgerStore.class);
        when(racing.getAssignment(DATE)).thenReturn(Optional.empty());
        when(racing.findAssignments(anyCollection())).thenReturn(Map.of());
        when(racing.insertIfAbsent(eq(DATE), anyLong())).thenReturn(LedgerInsert.alreadyAssigned(7L));

        AssignmentResult result = scheduler(new InMemoryPoolStore(pool), racing).assign(DATE).orElseThrow();

        assertEquals(7, result.getPuzzleId());
        assertFalse(result.isNewlyAssigned());
        assertFalse(result.isUsedFallback());
    }

    @Test
    void testLosingToSameSelectionIsNotNewlyAssigned() {
        // The other writer rotated to the same puzzle and committed it first
        LedgerStore racing = mock(LedgerStore.class);
        when(racing.getAssignment(DATE)).thenReturn(Optional.empty());
        when(racing.findAssignments(anyCollection())).thenReturn(Map.of());
        when(racing.insertIfAbsent(eq(DATE), anyLong())).thenReturn(LedgerInsert.alreadyAssigned(4L));

        AssignmentResult result = scheduler(new InMemoryPoolStore(pool), racing).assign(DATE).orElseThrow();

        assertEquals(4, result.getPuzzleId());
        assertFalse(result.isNewlyAssigned());
    }

    @Test
    void testConcurrentCallersWithSameSelection() throws Exception {
        List<AssignmentResult> results = assignConcurrently(scheduler(mock(PoolStore.class), ledger),
                Collections.nCopies(16, pool));

        assertEquals(Set.of(4L), results.stream().map(AssignmentResult::getPuzzleId).collect(Collectors.toSet()));
        assertEquals(1, results.stream().filter(AssignmentResult::isNewlyAssigned).count(),
                "Only the caller whose insert created the row is newly assigned");
        assertEquals(1, ledger.rows().size());
    }

    @Test
    void testConcurrentFirstRequestsAgree() throws Exception {
        // Two pool views that rotate to different puzzles, so the writers really disagree
        List<PuzzleEntry> viewA = new ArrayList<>(pool);
        List<PuzzleEntry> viewB = new ArrayList<>(pool.subList(0, 9));
        List<List<PuzzleEntry>> views = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            views.add(i % 2 == 0 ? viewA : viewB);
        }

        List<AssignmentResult> results = assignConcurrently(scheduler(mock(PoolStore.class), ledger), views);

        Set<Long> observed = results.stream()
                .map(AssignmentResult::getPuzzleId)
                .collect(Collectors.toSet());
        assertEquals(1, observed.size(), "Every caller sees the committed puzzle");
        assertEquals(1, results.stream().filter(AssignmentResult::isNewlyAssigned).count());
        assertEquals(1, ledger.rows().size());
        assertEquals(observed.iterator().next(), ledger.rows().get(DATE));
    }

    private static List<AssignmentResult> assignConcurrently(DailyPuzzleScheduler scheduler,
                                                             List<List<PuzzleEntry>> views) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(views.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AssignmentResult>> futures = new ArrayList<>();
        try {
            for (List<PuzzleEntry> view : views) {
                Callable<AssignmentResult> task = () -> {
                    start.await();
                    return scheduler.assign(DATE, view).orElseThrow();
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            return futures.stream()
                    .map(DailyPuzzleSchedulerTest::await)
                    .collect(Collectors.toList());
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void testEmptyPoolLeavesDateUnassigned() {
        Optional<AssignmentResult> result = scheduler(new InMemoryPoolStore(List.of()), ledger).assign(DATE);

        assertTrue(result.isEmpty());
        assertTrue(ledger.rows().isEmpty());
    }

    @Test
    void testInvalidDateKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler().assign("2024-02-31"));
        assertTrue(ledger.rows().isEmpty());
    }

    @Test
    void testRotateWrapsAndHandlesNegativeIndex() {
        List<Integer> items = List.of(0, 1, 2, 3, 4);

        assertEquals(List.of(3, 4, 0, 1, 2), DailyPuzzleScheduler.rotate(items, 8));
        assertEquals(List.of(4, 0, 1, 2, 3), DailyPuzzleScheduler.rotate(items, -1));
        assertEquals(items, DailyPuzzleScheduler.rotate(items, 10));
    }

    private static AssignmentResult await(Future<AssignmentResult> future) {
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
