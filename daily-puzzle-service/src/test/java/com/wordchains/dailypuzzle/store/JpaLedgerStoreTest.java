package com.wordchains.dailypuzzle.store;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.repository.DailyPuzzleRepository;
import com.wordchains.dailypuzzle.schedule.AssignmentResult;
import com.wordchains.dailypuzzle.schedule.DailyPuzzleScheduler;
import com.wordchains.dailypuzzle.support.Puzzles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class JpaLedgerStoreTest {

    @Autowired
    private JpaLedgerStore ledgerStore;

    @Autowired
    private DailyPuzzleScheduler scheduler;

    @Autowired
    private DailyPuzzleRepository repository;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    void testFirstWriterWins() {
        LedgerInsert first = ledgerStore.insertIfAbsent("2024-03-01", 11);
        LedgerInsert second = ledgerStore.insertIfAbsent("2024-03-01", 12);

        assertTrue(first.isInserted());
        assertEquals(11, first.getCommittedPuzzleId());
        assertFalse(second.isInserted());
        assertEquals(11, second.getCommittedPuzzleId());
        assertEquals(1, repository.count());
        assertEquals(Optional.of(11L), ledgerStore.getAssignment("2024-03-01"));
    }

    @Test
    void testSameProposalTwiceIsNotInsertedTwice() {
        assertTrue(ledgerStore.insertIfAbsent("2024-03-03", 9).isInserted());
        assertFalse(ledgerStore.insertIfAbsent("2024-03-03", 9).isInserted());
    }

    @Test
    void testLostRaceLogsNoError() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        root.addAppender(appender);
        try {
            ledgerStore.insertIfAbsent("2024-03-04", 21);
            assertFalse(ledgerStore.insertIfAbsent("2024-03-04", 22).isInserted());
        } finally {
            root.detachAppender(appender);
            appender.stop();
        }

        assertTrue(appender.list.stream().noneMatch(e -> e.getLevel().isGreaterOrEqual(Level.ERROR)),
                () -> "Unexpected error log: " + appender.list);
    }

    @Test
    void testUnassignedDate() {
        assertEquals(Optional.empty(), ledgerStore.getAssignment("2024-03-02"));
    }

    @Test
    void testFindAssignmentsReturnsOnlyExistingRows() {
        ledgerStore.insertIfAbsent("2024-02-27", 3);
        ledgerStore.insertIfAbsent("2024-02-29", 5);

        Map<String, Long> found = ledgerStore.findAssignments(
                List.of("2024-02-29", "2024-02-28", "2024-02-27"));

        assertEquals(Map.of("2024-02-29", 5L, "2024-02-27", 3L), found);
        assertTrue(ledgerStore.findAssignments(List.of()).isEmpty());
    }

    @Test
    void testConcurrentAssignmentHasOneWriter() throws Exception {
        List<PuzzleEntry> pool = List.of(
                Puzzles.entry(1L, "Ja"), Puzzles.entry(2L, "Jb"), Puzzles.entry(3L, "Jc"));
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AssignmentResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return scheduler.assign("2030-02-02", pool).orElseThrow();
                }));
            }
            start.countDown();

            List<AssignmentResult> results = new ArrayList<>();
            for (Future<AssignmentResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            assertEquals(1, repository.count());
            long committed = ledgerStore.getAssignment("2030-02-02").orElseThrow();
            assertTrue(results.stream().allMatch(r -> r.getPuzzleId() == committed));
            assertEquals(1, results.stream().filter(AssignmentResult::isNewlyAssigned).count());
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
