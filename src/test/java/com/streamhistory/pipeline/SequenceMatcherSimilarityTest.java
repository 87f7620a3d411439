package com.streamhistory.pipeline;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

public class SequenceMatcherSimilarityTest {
    private final SequenceMatcherSimilarity similarity = new SequenceMatcherSimilarity();

    @Test
    void testSingularVersusPlural() {
        assertEquals(22.0 / 23.0, similarity.score("Foo Fighter", "Foo Fighters"), 1e-9);
    }

    @Test
    void testIdenticalIgnoringCase() {
        assertEquals(1.0, similarity.score("Fall Out Boy", "fall out boy"), 1e-9);
    }

    @Test
    void testUnrelatedNamesScoreLow() {
        assertTrue(similarity.score("XYZ Band", "Foo Fighters") < 0.5);
        assertTrue(similarity.score("XYZ Band", "Fall Out Boy") < 0.5);
    }

    @Test
    void testSymmetricOnSimpleCase() {
        assertEquals(similarity.score("abcd", "bcde"), similarity.score("bcde", "abcd"), 1e-9);
        assertEquals(0.75, similarity.score("abcd", "bcde"), 1e-9);
    }

    @Test
    void testNullAndEmpty() {
        assertEquals(0.0, similarity.score(null, "x"));
        assertEquals(1.0, similarity.score("", ""));
        assertEquals(0.0, similarity.score("", "abc"));
    }
}
