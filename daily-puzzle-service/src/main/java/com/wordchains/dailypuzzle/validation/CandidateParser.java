package com.wordchains.dailypuzzle.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the generator's flat JSON object ({@code difficulty}, {@code word_1..word_8},
 * {@code dummy_1..dummy_10}, {@code qa_link_1..qa_link_7}) into a {@link PuzzleCandidate}.
 * Absent keys are left as null slots for the validator to report.
 */
@Component
public class CandidateParser {

    private final ObjectMapper objectMapper;

    public CandidateParser() {
        this.objectMapper = new ObjectMapper();
    }

    public CandidateParseResult parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return CandidateParseResult.err("Generator returned no content.");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return CandidateParseResult.err("Generator response is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return CandidateParseResult.err("Generator response is not a JSON object.");
        }

        List<String> problems = new ArrayList<>();
        PuzzleCandidate candidate = PuzzleCandidate.builder()
                .difficulty(text(root, "difficulty", problems))
                .chain(texts(root, "word_", CandidateValidator.CHAIN_LENGTH, problems))
                .dummies(texts(root, "dummy_", CandidateValidator.DUMMY_COUNT, problems))
                .links(texts(root, "qa_link_", CandidateValidator.LINK_COUNT, problems))
                .build();

        if (!problems.isEmpty()) {
            return CandidateParseResult.err(problems);
        }
        return CandidateParseResult.ok(candidate);
    }

    private List<String> texts(JsonNode root, String keyPrefix, int count, List<String> problems) {
        List<String> values = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            values.add(text(root, keyPrefix + i, problems));
        }
        return values;
    }

    private String text(JsonNode root, String key, List<String> problems) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            problems.add(key + " is not a string.");
            return null;
        }
        return node.asText();
    }
}
