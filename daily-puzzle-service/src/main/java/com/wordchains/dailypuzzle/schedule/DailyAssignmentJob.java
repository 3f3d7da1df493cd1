package com.wordchains.dailypuzzle.schedule;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Assigns today's and tomorrow's puzzles ahead of the first visitor.
 * Safe to run any number of times: assignment is idempotent per date.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "wordchains.daily", name = "preassign-enabled", havingValue = "true", matchIfMissing = true)
public class DailyAssignmentJob {

    private final DailyPuzzleScheduler scheduler;
    private final Clock clock;

    public DailyAssignmentJob(DailyPuzzleScheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Scheduled(cron = "${wordchains.daily.preassign-cron:0 5 0 * * *}", zone = "UTC")
    public void preassign() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        for (LocalDate day : List.of(today, today.plusDays(1))) {
            String dateKey = DayKeys.toKey(day);
            scheduler.assign(dateKey).ifPresentOrElse(
                    result -> log.info("Pre-assigned {} -> puzzle {}{}", dateKey, result.getPuzzleId(),
                            result.isNewlyAssigned() ? "" : " (already assigned)"),
                    () -> log.warn("Nothing to pre-assign for {}: puzzle pool is empty", dateKey));
        }
    }
}
