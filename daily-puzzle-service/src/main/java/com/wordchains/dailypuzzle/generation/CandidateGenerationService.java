package com.wordchains.dailypuzzle.generation;

import com.wordchains.dailypuzzle.config.PuzzleProperties;
import com.wordchains.dailypuzzle.entity.CandidateSubmission;
import com.wordchains.dailypuzzle.entity.PuzzleWords;
import com.wordchains.dailypuzzle.exception.CandidateGenerationException;
import com.wordchains.dailypuzzle.model.Difficulty;
import com.wordchains.dailypuzzle.repository.CandidateSubmissionRepository;
import com.wordchains.dailypuzzle.schedule.RecencyTracker;
import com.wordchains.dailypuzzle.store.PoolStore;
import com.wordchains.dailypuzzle.validation.BannedSet;
import com.wordchains.dailypuzzle.validation.CandidateParseResult;
import com.wordchains.dailypuzzle.validation.CandidateParser;
import com.wordchains.dailypuzzle.validation.CandidateValidator;
import com.wordchains.dailypuzzle.validation.PuzzleCandidate;
import com.wordchains.dailypuzzle.validation.ValidationReport;
import com.wordchains.rules.WordRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs a generation batch: one slot per entry of the difficulty plan, each slot retried
 * against an escalating banned set until a candidate validates or the budget runs out.
 */
@Slf4j
@Service
public class CandidateGenerationService {

    private final PoolStore poolStore;
    private final RecencyTracker recencyTracker;
    private final CandidateParser parser;
    private final CandidateValidator validator;
    private final CandidateSubmissionRepository submissionRepository;
    private final PuzzleProperties properties;
    private final Clock clock;

    public CandidateGenerationService(PoolStore poolStore,
                                      RecencyTracker recencyTracker,
                                      CandidateParser parser,
                                      CandidateValidator validator,
                                      CandidateSubmissionRepository submissionRepository,
                                      PuzzleProperties properties,
                                      Clock clock) {
        this.poolStore = poolStore;
        this.recencyTracker = recencyTracker;
        this.parser = parser;
        this.validator = validator;
        this.submissionRepository = submissionRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Generate, validate and review one batch.
     */
    public GenerationReport runBatch(CandidateGenerator generator, CandidateReviewer reviewer) {
        PuzzleProperties.Generation settings = properties.getGeneration();
        BannedSet banned = recencyTracker.recentlyCreated(
                poolStore.listApprovedPuzzles(), settings.getVarietyDays(), clock.instant());
        log.info("Starting generation batch of {} slots against {}", settings.getDifficultyPlan().size(), banned);

        int approved = 0;
        int rejected = 0;
        boolean stoppedEarly = false;
        List<Difficulty> failedSlots = new ArrayList<>();

        for (Difficulty difficulty : settings.getDifficultyPlan()) {
            SlotOutcome outcome = generateSlot(generator, difficulty, banned, settings);
            banned = outcome.banned;

            if (outcome.candidate == null) {
                log.warn("Failed to generate valid {} candidate after {} attempts", difficulty, settings.getRetryAttempts());
                failedSlots.add(difficulty);
                continue;
            }

            ReviewDecision decision = reviewer.review(outcome.candidate);
            if (decision == ReviewDecision.QUIT) {
                stoppedEarly = true;
                break;
            }
            if (decision == ReviewDecision.APPROVE) {
                save(outcome.candidate, settings.getApproveStatus());
                approved++;
                // Later slots in this run must not reuse what was just approved
                banned = banned.union(sameRunExclusions(outcome.candidate));
            } else {
                rejected++;
            }
        }

        log.info("Done. Approved: {}, Rejected: {}, Failed slots: {}", approved, rejected, failedSlots);
        return GenerationReport.builder()
                .approved(approved)
                .rejected(rejected)
                .failedSlots(failedSlots)
                .stoppedEarly(stoppedEarly)
                .build();
    }

    SlotOutcome generateSlot(CandidateGenerator generator, Difficulty difficulty,
                             BannedSet banned, PuzzleProperties.Generation settings) {
        BannedSet current = banned;
        for (int attempt = 1; attempt <= settings.getRetryAttempts(); attempt++) {
            String payload;
            try {
                payload = generator.produceCandidate(difficulty, current);
            } catch (CandidateGenerationException e) {
                log.warn("Generator error [{}] attempt {}/{}: {}", difficulty, attempt, settings.getRetryAttempts(), e.getMessage());
                continue;
            }

            CandidateParseResult parsed = parser.parse(payload);
            if (!parsed.isOk()) {
                log.debug("Rejected candidate (unreadable) [{}] -> {}", difficulty, String.join("; ", parsed.getErrors()));
                continue;
            }

            ValidationReport report = validator.validate(
                    parsed.getCandidate(), difficulty, current, settings.getMaxReusedWords());
            if (report.isAccepted()) {
                report.getWarnings().forEach(w -> log.debug("Warning [{}]: {}", difficulty, w.getMessage()));
                return new SlotOutcome(parsed.getCandidate(), current);
            }

            log.debug("Rejected candidate (auto) [{}] -> {}", difficulty, report.summary());
            current = current.escalate(report.bannedLinkConflicts(), report.bannedEndpointConflicts());
        }
        return new SlotOutcome(null, current);
    }

    private BannedSet sameRunExclusions(PuzzleCandidate candidate) {
        Set<String> links = candidate.getLinks().stream()
                .map(WordRules::normalizeLink)
                .collect(Collectors.toSet());
        List<String> chain = candidate.getChain();
        Set<String> endpoints = new HashSet<>(List.of(
                WordRules.normalizeWord(chain.get(0)),
                WordRules.normalizeWord(chain.get(chain.size() - 1))));
        return BannedSet.of(links, endpoints, Set.of());
    }

    private void save(PuzzleCandidate candidate, String status) {
        CandidateSubmission submission = CandidateSubmission.builder()
                .status(status)
                .difficulty(candidate.getDifficulty())
                .words(PuzzleWords.of(candidate.getChain(), candidate.getDummies(), candidate.getLinks()))
                .createdAt(clock.instant())
                .build();
        submissionRepository.save(submission);
        log.info("Saved {} candidate: {}", candidate.getDifficulty(), String.join(" -> ", candidate.getChain()));
    }

    /**
     * Result of one slot: the accepted candidate (or null) and the banned set as escalated so far
     */
    static class SlotOutcome {
        final PuzzleCandidate candidate;
        final BannedSet banned;

        SlotOutcome(PuzzleCandidate candidate, BannedSet banned) {
            this.candidate = candidate;
            this.banned = banned;
        }
    }
}
