package com.wordchains.dailypuzzle.store;

import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.repository.PuzzleEntryRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class JpaPoolStore implements PoolStore {

    private final PuzzleEntryRepository repository;

    public JpaPoolStore(PuzzleEntryRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<PuzzleEntry> listApprovedPuzzles() {
        return repository.findAllByOrderByIdAsc();
    }

    @Override
    public Optional<PuzzleEntry> findPuzzle(long id) {
        return repository.findById(id);
    }
}
