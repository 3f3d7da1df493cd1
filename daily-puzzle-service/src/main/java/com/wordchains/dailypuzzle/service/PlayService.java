package com.wordchains.dailypuzzle.service;

import com.wordchains.dailypuzzle.dto.PuzzleStats;
import com.wordchains.dailypuzzle.entity.Play;
import com.wordchains.dailypuzzle.model.PlayResult;
import com.wordchains.dailypuzzle.repository.PlayRepository;
import com.wordchains.dailypuzzle.schedule.DayKeys;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class PlayService {

    static final int MAX_ATTEMPTS = 4;

    private final PlayRepository playRepository;
    private final Clock clock;

    public PlayService(PlayRepository playRepository, Clock clock) {
        this.playRepository = playRepository;
        this.clock = clock;
    }

    /**
     * Record a finished game. A player keeps one row per puzzle; replays overwrite it.
     */
    @Transactional
    public Play recordPlay(String userId, long puzzleId, PlayResult result, int attempts,
                           Integer durationSeconds, String localDate) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (attempts < 1 || attempts > MAX_ATTEMPTS) {
            throw new IllegalArgumentException("attempts must be between 1 and " + MAX_ATTEMPTS);
        }
        String dateKey = localDate == null ? null : DayKeys.toKey(DayKeys.parse(localDate));

        Play play = playRepository.findByUserIdAndPuzzleRowId(userId, puzzleId)
                .orElseGet(() -> Play.builder()
                        .userId(userId)
                        .puzzleRowId(puzzleId)
                        .build());
        play.setResult(result);
        play.setAttempts(attempts);
        play.setDurationSeconds(durationSeconds);
        play.setLocalDate(dateKey);
        play.setPlayedAt(clock.instant());
        return playRepository.save(play);
    }

    /**
     * Result distribution for a puzzle, optionally limited to plays on one local date
     */
    public PuzzleStats getStats(long puzzleId, String localDate) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 1; i <= MAX_ATTEMPTS; i++) {
            counts.put(String.valueOf(i), 0);
        }
        counts.put("loss", 0);

        String targetDate = localDate == null || localDate.isBlank() ? null : localDate.trim();
        List<Play> plays = playRepository.findByPuzzleRowId(puzzleId);
        int total = 0;
        for (Play play : plays) {
            if (targetDate != null && !targetDate.equals(play.getLocalDate())) {
                continue;
            }
            if (play.getResult() == PlayResult.LOSS) {
                counts.merge("loss", 1, Integer::sum);
                total++;
            } else if (play.getAttempts() >= 1 && play.getAttempts() <= MAX_ATTEMPTS) {
                counts.merge(String.valueOf(play.getAttempts()), 1, Integer::sum);
                total++;
            }
        }

        return PuzzleStats.builder()
                .puzzleId(puzzleId)
                .total(total)
                .counts(counts)
                .build();
    }
}
