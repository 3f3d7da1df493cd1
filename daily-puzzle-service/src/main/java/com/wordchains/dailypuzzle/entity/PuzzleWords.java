package com.wordchains.dailypuzzle.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * The word columns shared by pool rows and stored candidates:
 * eight chain words, ten distractors and seven links.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PuzzleWords {

    @Column(name = "word_1", length = 60)
    private String word1;
    @Column(name = "word_2", length = 60)
    private String word2;
    @Column(name = "word_3", length = 60)
    private String word3;
    @Column(name = "word_4", length = 60)
    private String word4;
    @Column(name = "word_5", length = 60)
    private String word5;
    @Column(name = "word_6", length = 60)
    private String word6;
    @Column(name = "word_7", length = 60)
    private String word7;
    @Column(name = "word_8", length = 60)
    private String word8;

    @Column(name = "dummy_1", length = 60)
    private String dummy1;
    @Column(name = "dummy_2", length = 60)
    private String dummy2;
    @Column(name = "dummy_3", length = 60)
    private String dummy3;
    @Column(name = "dummy_4", length = 60)
    private String dummy4;
    @Column(name = "dummy_5", length = 60)
    private String dummy5;
    @Column(name = "dummy_6", length = 60)
    private String dummy6;
    @Column(name = "dummy_7", length = 60)
    private String dummy7;
    @Column(name = "dummy_8", length = 60)
    private String dummy8;
    @Column(name = "dummy_9", length = 60)
    private String dummy9;
    @Column(name = "dummy_10", length = 60)
    private String dummy10;

    // Older rows were authored before links were recorded and leave these null
    @Column(name = "qa_link_1", length = 120)
    private String qaLink1;
    @Column(name = "qa_link_2", length = 120)
    private String qaLink2;
    @Column(name = "qa_link_3", length = 120)
    private String qaLink3;
    @Column(name = "qa_link_4", length = 120)
    private String qaLink4;
    @Column(name = "qa_link_5", length = 120)
    private String qaLink5;
    @Column(name = "qa_link_6", length = 120)
    private String qaLink6;
    @Column(name = "qa_link_7", length = 120)
    private String qaLink7;

    public List<String> chainWords() {
        return Arrays.asList(word1, word2, word3, word4, word5, word6, word7, word8);
    }

    public List<String> dummyWords() {
        return Arrays.asList(dummy1, dummy2, dummy3, dummy4, dummy5, dummy6, dummy7, dummy8, dummy9, dummy10);
    }

    public List<String> links() {
        return Arrays.asList(qaLink1, qaLink2, qaLink3, qaLink4, qaLink5, qaLink6, qaLink7);
    }

    /**
     * Build the column block from positional lists. Short or null lists leave trailing columns null.
     */
    public static PuzzleWords of(List<String> chain, List<String> dummies, List<String> links) {
        return PuzzleWords.builder()
                .word1(at(chain, 0)).word2(at(chain, 1)).word3(at(chain, 2)).word4(at(chain, 3))
                .word5(at(chain, 4)).word6(at(chain, 5)).word7(at(chain, 6)).word8(at(chain, 7))
                .dummy1(at(dummies, 0)).dummy2(at(dummies, 1)).dummy3(at(dummies, 2))
                .dummy4(at(dummies, 3)).dummy5(at(dummies, 4)).dummy6(at(dummies, 5))
                .dummy7(at(dummies, 6)).dummy8(at(dummies, 7)).dummy9(at(dummies, 8))
                .dummy10(at(dummies, 9))
                .qaLink1(at(links, 0)).qaLink2(at(links, 1)).qaLink3(at(links, 2)).qaLink4(at(links, 3))
                .qaLink5(at(links, 4)).qaLink6(at(links, 5)).qaLink7(at(links, 6))
                .build();
    }

    private static String at(List<String> values, int index) {
        if (values == null || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }
}
