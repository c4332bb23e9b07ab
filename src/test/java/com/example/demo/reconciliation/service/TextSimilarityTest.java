package com.example.demo.reconciliation.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextSimilarityTest {

    @Test
    void testSimilarity_ContainmentScoresOne() {
        assertEquals(1.0, TextSimilarity.similarity("Acme Pharma", "ACME PHARMA, INC."));
    }

    @Test
    void testSimilarity_EditDistance() {
        // "kitten" -> "sitting" is 3 edits over 7 characters
        assertEquals(1.0 - 3.0 / 7.0, TextSimilarity.similarity("kitten", "sitting"), 1e-9);
        assertEquals(3, TextSimilarity.levenshteinDistance("kitten", "sitting"));
    }

    @Test
    void testSimilarity_BlankScoresZero() {
        assertEquals(0.0, TextSimilarity.similarity(null, "Acme"));
        assertEquals(0.0, TextSimilarity.similarity("Acme", "  "));
    }

    @Test
    void testSameReference() {
        assertTrue(TextSimilarity.sameReference("PO-1001", "po 1001"));
        assertFalse(TextSimilarity.sameReference("PO-1001", "PO-1002"));
        assertFalse(TextSimilarity.sameReference(null, null));
    }
}
