package com.wordchains.dailypuzzle.service;

import com.wordchains.dailypuzzle.config.PuzzleProperties;
import com.wordchains.dailypuzzle.dto.DailyPuzzleView;
import com.wordchains.dailypuzzle.dto.NextPuzzle;
import com.wordchains.dailypuzzle.dto.PuzzleView;
import com.wordchains.dailypuzzle.entity.PuzzleEntry;
import com.wordchains.dailypuzzle.model.PuzzleMode;
import com.wordchains.dailypuzzle.repository.PlayRepository;
import com.wordchains.dailypuzzle.schedule.AssignmentResult;
import com.wordchains.dailypuzzle.schedule.DailyPuzzleScheduler;
import com.wordchains.dailypuzzle.schedule.DayKeys;
import com.wordchains.dailypuzzle.store.PoolStore;
import com.wordchains.rules.SeededShuffle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

@Slf4j
@Service
public class PuzzleService {

    private final DailyPuzzleScheduler scheduler;
    private final PoolStore poolStore;
    private final PlayRepository playRepository;
    private final PuzzleProperties properties;
    private final Clock clock;

    public PuzzleService(DailyPuzzleScheduler scheduler,
                         PoolStore poolStore,
                         PlayRepository playRepository,
                         PuzzleProperties properties,
                         Clock clock) {
        this.scheduler = scheduler;
        this.poolStore = poolStore;
        this.playRepository = playRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Get today's puzzle (UTC calendar)
     */
    public Optional<DailyPuzzleView> getTodaysPuzzle() {
        return getDailyPuzzle(DayKeys.toKey(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC)));
    }

    /**
     * Get the puzzle for a date, assigning one if the date has none yet
     */
    public Optional<DailyPuzzleView> getDailyPuzzle(String dateKey) {
        Optional<AssignmentResult> assignment = scheduler.assign(dateKey);
        if (assignment.isEmpty()) {
            return Optional.empty();
        }

        AssignmentResult result = assignment.get();
        Optional<PuzzleEntry> entry = poolStore.findPuzzle(result.getPuzzleId());
        if (entry.isEmpty()) {
            log.warn("Ledger points {} at puzzle {}, which is not in the pool", result.getDateKey(), result.getPuzzleId());
            return Optional.empty();
        }

        OptionalLong dayNumber = DayKeys.dayNumber(result.getDateKey(), properties.getDaily().getLaunchDate());
        long puzzleNumber = dayNumber.isPresent() ? dayNumber.getAsLong() : entry.get().getId();
        return Optional.of(DailyPuzzleView.builder()
                .dateKey(result.getDateKey())
                .puzzle(PuzzleView.from(entry.get(), PuzzleMode.DAILY, puzzleNumber))
                .similarityGuardFallback(result.isUsedFallback())
                .build());
    }

    /**
     * Get any pool puzzle by id
     */
    public Optional<PuzzleView> getArchivePuzzle(long id) {
        return poolStore.findPuzzle(id)
                .map(entry -> PuzzleView.from(entry, PuzzleMode.ARCHIVE, entry.getId()));
    }

    /**
     * Next unplayed puzzle in the player's own stable ordering of the pool
     */
    public NextPuzzle nextEndlessPuzzle(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }

        Set<Long> played = new HashSet<>(playRepository.findPlayedPuzzleIds(userId));
        List<PuzzleEntry> ordered = SeededShuffle.shuffle(poolStore.listApprovedPuzzles(), userId);

        return ordered.stream()
                .filter(entry -> !played.contains(entry.getId()))
                .findFirst()
                .map(entry -> new NextPuzzle(PuzzleView.from(entry, PuzzleMode.ENDLESS, entry.getId()), true))
                .orElseGet(NextPuzzle::exhausted);
    }
}
