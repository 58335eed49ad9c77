package com.websearch.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TfIdfScorerTest {

    @Test
    void testIdfIsNaturalLog() {
        TfIdfScorer scorer = new TfIdfScorer(3);

        assertEquals(Math.log(3.0), scorer.computeIDF(1), 1e-12);
        assertEquals(Math.log(1.5), scorer.computeIDF(2), 1e-12);
    }

    @Test
    void testIdfDecreasesWithDocumentFrequency() {
        TfIdfScorer scorer = new TfIdfScorer(100);

        double previous = Double.MAX_VALUE;
        for (int df = 1; df <= 100; df++) {
            double idf = scorer.computeIDF(df);
            assertTrue(idf <= previous, "idf 应随 df 单调不增, df=" + df);
            assertTrue(idf >= 0.0);
            previous = idf;
        }
    }

    @Test
    void testTermInEveryDocumentContributesNothing() {
        TfIdfScorer scorer = new TfIdfScorer(7);

        assertEquals(0.0, scorer.computeIDF(7));
        assertEquals(0.0, scorer.score(12, 7));
    }

    @Test
    void testDegenerateInputs() {
        assertEquals(0.0, new TfIdfScorer(5).computeIDF(0));
        assertEquals(0.0, new TfIdfScorer(0).computeIDF(1));
        assertEquals(0.0, new TfIdfScorer(5).score(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new TfIdfScorer(-1));
    }

    @Test
    void testScoreScalesWithWeight() {
        TfIdfScorer scorer = new TfIdfScorer(10);

        assertEquals(6 * Math.log(10.0 / 3), scorer.score(6, 3), 1e-12);
    }
}
