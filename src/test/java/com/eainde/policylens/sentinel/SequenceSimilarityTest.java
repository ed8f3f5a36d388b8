package com.eainde.policylens.sentinel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequenceSimilarityTest {

    @Test
    @DisplayName("rates identical texts 1.0 and disjoint texts 0.0")
    void extremes() {
        assertThat(SequenceSimilarity.ratio("policy text", "policy text")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("abc", "xyz")).isEqualTo(0.0);
        assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("abc", "")).isEqualTo(0.0);
        assertThat(SequenceSimilarity.ratio(null, "abc")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("counts the longest block, then recurses on either side")
    void matchingBlocks() {
        assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isEqualTo(0.75);
        // "ab" + "cd"
        assertThat(SequenceSimilarity.matchingCharacters("abxcd", "abcd")).isEqualTo(4);
        assertThat(SequenceSimilarity.ratio("abxcd", "abcd")).isCloseTo(8.0 / 9.0, within(1e-12));
        // only one block survives reversal
        assertThat(SequenceSimilarity.ratio("abcd", "dcba")).isEqualTo(0.25);
    }

    @Test
    @DisplayName("does not discard frequently repeated characters")
    void noJunkHeuristic() {
        String a = "a".repeat(300) + "b";
        String b = "a".repeat(300) + "c";

        assertThat(SequenceSimilarity.matchingCharacters(a, b)).isEqualTo(300);
    }

    @Test
    @DisplayName("rates a three-character edit of a twenty-character text at 0.85")
    void smallEdit() {
        assertThat(SequenceSimilarity.ratio("abcdefghijklmnopqrst", "abcdefghijklmnopqXYZ"))
                .isCloseTo(0.85, within(1e-12));
    }
}
