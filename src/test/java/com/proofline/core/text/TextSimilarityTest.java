package com.proofline.core.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSimilarityTest {

    @Test
    @DisplayName("identical strings score 100")
    void identical() {
        assertEquals(100.0, TextSimilarity.score("fine", "fine"));
    }

    @Test
    @DisplayName("two empty strings score 100, one empty scores 0")
    void emptyStrings() {
        assertEquals(100.0, TextSimilarity.score("", ""));
        assertEquals(0.0, TextSimilarity.score("abc", ""));
        assertEquals(100.0, TextSimilarity.score(null, null));
    }

    @Test
    @DisplayName("score follows the normalised indel ratio")
    void knownRatio() {
        // lcs("bad txt", "bad text") = 7, total length 15 -> 2*7/15
        assertEquals(93.33, TextSimilarity.score("bad txt", "bad text"));
        // lcs("abc", "xyz") = 0
        assertEquals(0.0, TextSimilarity.score("abc", "xyz"));
    }

    @Test
    @DisplayName("score is symmetric and deterministic")
    void symmetric() {
        double first = TextSimilarity.score("kitten", "sitting");
        assertEquals(first, TextSimilarity.score("sitting", "kitten"));
        assertEquals(first, TextSimilarity.score("kitten", "sitting"));
        assertTrue(first < 100.0);
    }

    @Test
    @DisplayName("LCS of a classic pair")
    void lcs() {
        assertEquals(4, TextSimilarity.longestCommonSubsequence("ABCBDAB", "BDCABA"));
        assertEquals(0, TextSimilarity.longestCommonSubsequence("", "abc"));
    }

    @Test
    @DisplayName("supplementary characters count once")
    void codePoints() {
        // 3 code points each, 2 in common; as UTF-16 units this would be 6 of 8
        assertEquals(66.67, TextSimilarity.score("a\uD83D\uDE00b", "a\uD83D\uDE01b"));
        assertEquals(66.67, TextSimilarity.score("\uD83D\uDE00", "\uD83D\uDE00x"));
        assertEquals(1, TextSimilarity.longestCommonSubsequence("\uD83D\uDE00", "\uD83D\uDE01\uD83D\uDE00"));
    }
}
