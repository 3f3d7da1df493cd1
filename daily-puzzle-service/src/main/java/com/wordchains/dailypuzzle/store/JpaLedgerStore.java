package com.wordchains.dailypuzzle.store;

import com.wordchains.dailypuzzle.entity.DailyPuzzle;
import com.wordchains.dailypuzzle.repository.DailyPuzzleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger backed by the daily_puzzles table. Each call runs in its own repository
 * transaction, so a rejected insert never poisons the caller's work.
 */
@Slf4j
@Component
public class JpaLedgerStore implements LedgerStore {

    private final DailyPuzzleRepository repository;

    public JpaLedgerStore(DailyPuzzleRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<Long> getAssignment(String dateKey) {
        return repository.findById(dateKey).map(DailyPuzzle::getPuzzleRowId);
    }

    @Override
    public LedgerInsert insertIfAbsent(String dateKey, long puzzleId) {
        try {
            repository.saveAndFlush(new DailyPuzzle(dateKey, puzzleId));
            return LedgerInsert.inserted(puzzleId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Ledger already holds {}, reading the committed row", dateKey);
            return getAssignment(dateKey)
                    .map(LedgerInsert::alreadyAssigned)
                    .orElseThrow(() -> new IllegalStateException(
                            "Ledger rejected insert for " + dateKey + " but holds no row for it", e));
        }
    }

    @Override
    public Map<String, Long> findAssignments(Collection<String> dateKeys) {
        Map<String, Long> assignments = new LinkedHashMap<>();
        if (dateKeys.isEmpty()) {
            return assignments;
        }
        for (DailyPuzzle row : repository.findByDateKeyIn(dateKeys)) {
            assignments.put(row.getDateKey(), row.getPuzzleRowId());
        }
        return assignments;
    }
}
