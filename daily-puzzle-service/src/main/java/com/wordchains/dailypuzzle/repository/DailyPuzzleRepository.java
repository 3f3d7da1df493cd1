package com.wordchains.dailypuzzle.repository;

import com.wordchains.dailypuzzle.entity.DailyPuzzle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface DailyPuzzleRepository extends JpaRepository<DailyPuzzle, String> {

    List<DailyPuzzle> findByDateKeyIn(Collection<String> dateKeys);
}
