package com.wordchains.dailypuzzle.repository;

import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PuzzleEntryRepository extends JpaRepository<PuzzleEntry, Long> {

    List<PuzzleEntry> findAllByOrderByIdAsc();
}
