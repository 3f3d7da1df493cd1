package com.wordchains.dailypuzzle.config;

import com.wordchains.dailypuzzle.model.Difficulty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for daily scheduling and candidate generation.
 *
 * <p>Config prefix: {@code wordchains}</p>
 */
@Data
@ConfigurationProperties(prefix = "wordchains")
public class PuzzleProperties {

    private Daily daily = new Daily();

    private Generation generation = new Generation();

    @Data
    public static class Daily {

        /** Trailing days whose assigned puzzles feed the similarity guard. */
        private int windowDays = 30;

        /**
         * ISO date of day #1. When unset, daily puzzles are numbered by their pool id.
         */
        private String launchDate;

        private boolean preassignEnabled = true;

        /** Cron for the pre-assignment job, evaluated in UTC. */
        private String preassignCron = "0 5 0 * * *";
    }

    @Data
    public static class Generation {

        /** Days of pool history whose links, endpoints and words count as recently used. */
        private int varietyDays = 14;

        /** Chain words allowed to repeat recently used words. */
        private int maxReusedWords = 4;

        /** Attempts per difficulty slot before the slot is given up. */
        private int retryAttempts = 8;

        /** Reject candidates whose first or last word was a recent endpoint. */
        private boolean hardBlockEndpoints = false;

        /** Size of the soft avoid-word sample handed to the generator. */
        private int avoidWordSample = 80;

        /** Status stored on approved candidates. */
        private String approveStatus = "approved";

        private List<Difficulty> difficultyPlan = new ArrayList<>(List.of(
                Difficulty.EASY, Difficulty.EASY, Difficulty.EASY,
                Difficulty.EASY, Difficulty.EASY, Difficulty.EASY,
                Difficulty.MEDIUM, Difficulty.MEDIUM, Difficulty.MEDIUM,
                Difficulty.HARD
        ));
    }
}
