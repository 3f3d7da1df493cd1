package com.wordchains.dailypuzzle.support;

import com.wordchains.dailypuzzle.store.LedgerInsert;
import com.wordchains.dailypuzzle.store.LedgerStore;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ledger whose atomic insert is {@link ConcurrentMap#putIfAbsent}.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentMap<String, Long> rows = new ConcurrentHashMap<>();
    private final AtomicInteger insertCalls = new AtomicInteger();

    public InMemoryLedgerStore with(String dateKey, long puzzleId) {
        rows.put(dateKey, puzzleId);
        return this;
    }

    @Override
    public Optional<Long> getAssignment(String dateKey) {
        return Optional.ofNullable(rows.get(dateKey));
    }

    @Override
    public LedgerInsert insertIfAbsent(String dateKey, long puzzleId) {
        insertCalls.incrementAndGet();
        Long previous = rows.putIfAbsent(dateKey, puzzleId);
        return previous != null ? LedgerInsert.alreadyAssigned(previous) : LedgerInsert.inserted(puzzleId);
    }

    @Override
    public Map<String, Long> findAssignments(Collection<String> dateKeys) {
        Map<String, Long> found = new LinkedHashMap<>();
        for (String key : dateKeys) {
            Long id = rows.get(key);
            if (id != null) {
                found.put(key, id);
            }
        }
        return found;
    }

    public Map<String, Long> rows() {
        return rows;
    }

    public int insertCalls() {
        return insertCalls.get();
    }
}
