package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CandidateScore;
import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.InvoiceLineItem;
import com.example.demo.reconciliation.model.LineItemMatch;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.Party;
import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.model.PurchaseOrderLineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for candidate scoring and selection.
 */
class ScoringServiceTest {

    private ScoringService scoringService;
    private MatchingSettings settings;

    @BeforeEach
    void setUp() {
        scoringService = new ScoringService();
        settings = MatchingSettings.defaults();
    }

    @Test
    void testScore_CombinesLineHeaderAndCoverage() {
        // Arrange
        Invoice invoice = new Invoice("INV-1", "PO-77", new Party("Acme Pharma", null), invoiceLines(2));
        PurchaseOrder po = new PurchaseOrder("po-1", "PO-77", new Party("Acme Pharma", null), poLines(3));
        List<LineItemMatch> matches = Arrays.asList(
                LineItemMatch.matched(1, 1, 1.0),
                LineItemMatch.matched(2, 2, 0.8),
                LineItemMatch.unmatchedPoLine(3));

        // Act
        CandidateScore score = scoringService.score(invoice, po, matches, settings);

        // Assert
        assertEquals(0.9, score.getMeanSimilarity(), 1e-9);
        assertEquals(1.0, score.getHeaderAgreement(), 1e-9);
        assertEquals(2.0 / 3.0, score.getCoverage(), 1e-9);
        assertEquals(0.7 * 0.9 + 0.2 * 1.0 + 0.1 * (2.0 / 3.0), score.getOverallScore(), 1e-9);
        assertSame(po, score.getPurchaseOrder());
    }

    @Test
    void testScore_NoLinesOnEitherSide() {
        // Arrange
        Invoice invoice = new Invoice("INV-1", "PO-77", null, new ArrayList<>());
        PurchaseOrder po = new PurchaseOrder("po-1", "po 77", null, new ArrayList<>());

        // Act
        CandidateScore score = scoringService.score(invoice, po, Collections.emptyList(), settings);

        // Assert: the PO number is the only header signal and it agrees
        assertEquals(0.0, score.getCoverage());
        assertEquals(0.0, score.getMeanSimilarity());
        assertEquals(1.0, score.getHeaderAgreement(), 1e-9);
        assertEquals(0.2, score.getOverallScore(), 1e-9);
    }

    @Test
    void testScore_InvoiceWithoutPoNumberCanStillScorePerfectly() {
        // Arrange
        Invoice invoice = new Invoice("INV-1", null, new Party("Acme Pharma", null), invoiceLines(2));
        PurchaseOrder po = new PurchaseOrder("po-1", "PO-77", new Party("Acme Pharma", null), poLines(2));
        List<LineItemMatch> matches = List.of(
                LineItemMatch.matched(1, 1, 1.0),
                LineItemMatch.matched(2, 2, 1.0));

        // Act
        CandidateScore score = scoringService.score(invoice, po, matches, settings);

        // Assert
        assertEquals(1.0, score.getHeaderAgreement(), 1e-9);
        assertEquals(1.0, score.getOverallScore(), 1e-9);
    }

    @Test
    void testHeaderAgreement_OnlySignalsTheInvoiceCarries() {
        PurchaseOrder po = new PurchaseOrder("po-1", "PO-77", new Party("Acme Pharma", null), new ArrayList<>());

        Invoice vendorOnly = new Invoice("INV-1", " ", new Party("Acme Pharma", null), new ArrayList<>());
        Invoice bothDisagreeOnNumber = new Invoice("INV-2", "PO-99", new Party("Acme Pharma", null),
                new ArrayList<>());
        Invoice neither = new Invoice("INV-3", null, null, new ArrayList<>());

        assertEquals(1.0, scoringService.headerAgreement(vendorOnly, po), 1e-9);
        assertEquals(0.5, scoringService.headerAgreement(bothDisagreeOnNumber, po), 1e-9);
        assertEquals(0.0, scoringService.headerAgreement(neither, po), 1e-9);
    }

    @Test
    void testSelectBest_TieKeepsEarlierCandidate() {
        // Arrange
        CandidateScore first = candidateScore("po-1", 0.8);
        CandidateScore second = candidateScore("po-2", 0.8);
        CandidateScore weaker = candidateScore("po-3", 0.4);

        // Act
        Optional<CandidateScore> best = scoringService.selectBest(Arrays.asList(weaker, first, second));

        // Assert
        assertTrue(best.isPresent());
        assertEquals("po-1", best.get().getPurchaseOrder().getId());
        assertFalse(scoringService.selectBest(Collections.emptyList()).isPresent());
    }

    @Test
    void testIsAccepted_ThresholdIsInclusive() {
        assertTrue(scoringService.isAccepted(candidateScore("po-1", 0.5), settings));
        assertFalse(scoringService.isAccepted(candidateScore("po-1", 0.49), settings));

        MatchingSettings strict = MatchingSettings.builder().acceptanceThreshold(0.9).build();
        assertFalse(scoringService.isAccepted(candidateScore("po-1", 0.8), strict));
    }

    private static CandidateScore candidateScore(String poId, double overall) {
        PurchaseOrder po = new PurchaseOrder(poId, null, null, new ArrayList<>());
        return new CandidateScore(po, overall, 0.0, 0.0, 0.0, Collections.emptyList());
    }

    private static List<InvoiceLineItem> invoiceLines(int count) {
        List<InvoiceLineItem> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add(new InvoiceLineItem(i, "Item " + i, null, 1, BigDecimal.ONE));
        }
        return lines;
    }

    private static List<PurchaseOrderLineItem> poLines(int count) {
        List<PurchaseOrderLineItem> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add(new PurchaseOrderLineItem(i, "Item " + i, null, 1, BigDecimal.ONE));
        }
        return lines;
    }
}
