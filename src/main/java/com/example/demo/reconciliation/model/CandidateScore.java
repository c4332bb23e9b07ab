package com.example.demo.reconciliation.model;

import java.util.List;

/**
 * Overall score of one candidate purchase order together with the line
 * alignment it was computed from.
 */
public final class CandidateScore {

    private final PurchaseOrder purchaseOrder;
    private final double overallScore;
    private final double meanSimilarity;
    private final double headerAgreement;
    private final double coverage;
    private final List<LineItemMatch> lineMatches;

    public CandidateScore(PurchaseOrder purchaseOrder, double overallScore, double meanSimilarity,
            double headerAgreement, double coverage, List<LineItemMatch> lineMatches) {
        this.purchaseOrder = purchaseOrder;
        this.overallScore = overallScore;
        this.meanSimilarity = meanSimilarity;
        this.headerAgreement = headerAgreement;
        this.coverage = coverage;
        this.lineMatches = List.copyOf(lineMatches);
    }

    public PurchaseOrder getPurchaseOrder() {
        return purchaseOrder;
    }

    public double getOverallScore() {
        return overallScore;
    }

    public double getMeanSimilarity() {
        return meanSimilarity;
    }

    public double getHeaderAgreement() {
        return headerAgreement;
    }

    public double getCoverage() {
        return coverage;
    }

    public List<LineItemMatch> getLineMatches() {
        return lineMatches;
    }

    @Override
    public String toString() {
        return String.format("CandidateScore{po=%s, overall=%.4f, lines=%.4f, header=%.4f, coverage=%.4f}",
                purchaseOrder.getId(), overallScore, meanSimilarity, headerAgreement, coverage);
    }
}
