package com.wordchains.dailypuzzle.repository;

import com.wordchains.dailypuzzle.entity.Play;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayRepository extends JpaRepository<Play, Long> {

    Optional<Play> findByUserIdAndPuzzleRowId(String userId, Long puzzleRowId);

    List<Play> findByPuzzleRowId(Long puzzleRowId);

    @Query("SELECT p.puzzleRowId FROM Play p WHERE p.userId = ?1")
    List<Long> findPlayedPuzzleIds(String userId);
}
