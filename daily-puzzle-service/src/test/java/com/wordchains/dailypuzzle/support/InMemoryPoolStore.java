package com.wordchains.dailypuzzle.support;

import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.store.PoolStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryPoolStore implements PoolStore {

    private final List<PuzzleEntry> entries = new ArrayList<>();

    public InMemoryPoolStore(List<PuzzleEntry> entries) {
        this.entries.addAll(entries);
        this.entries.sort(Comparator.comparing(PuzzleEntry::getId));
    }

    @Override
    public List<PuzzleEntry> listApprovedPuzzles() {
        return new ArrayList<>(entries);
    }

    @Override
    public Optional<PuzzleEntry> findPuzzle(long id) {
        return entries.stream().filter(p -> p.getId() == id).findFirst();
    }
}
