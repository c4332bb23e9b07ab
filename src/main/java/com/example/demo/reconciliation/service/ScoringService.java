package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CandidateScore;
import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.LineItemMatch;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.PurchaseOrder;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Combines line alignment and header agreement into one score per candidate
 * purchase order, and picks the winner.
 */
@Service
public class ScoringService {

    /**
     * overall = lineWeight * mean pair similarity
     *         + headerWeight * header agreement
     *         + coverageWeight * matched / max(invoice lines, PO lines)
     */
    public CandidateScore score(Invoice invoice, PurchaseOrder candidate, List<LineItemMatch> lineMatches,
            MatchingSettings settings) {

        int pairedCount = 0;
        double similaritySum = 0.0;
        for (LineItemMatch match : lineMatches) {
            if (match.isPaired()) {
                pairedCount++;
                similaritySum += match.getSimilarity();
            }
        }
        double meanSimilarity = pairedCount > 0 ? similaritySum / pairedCount : 0.0;

        int invoiceLineCount = invoice.getItems() != null ? invoice.getItems().size() : 0;
        int poLineCount = candidate.getItems() != null ? candidate.getItems().size() : 0;
        int largerSide = Math.max(invoiceLineCount, poLineCount);
        double coverage = largerSide > 0 ? (double) pairedCount / largerSide : 0.0;

        double headerAgreement = headerAgreement(invoice, candidate);

        double overall = settings.getLineSimilarityWeight() * meanSimilarity
                + settings.getHeaderWeight() * headerAgreement
                + settings.getCoverageWeight() * coverage;

        return new CandidateScore(candidate, Math.max(0.0, Math.min(1.0, overall)),
                meanSimilarity, headerAgreement, coverage, lineMatches);
    }

    /**
     * Mean of vendor-name similarity and PO-number equality, taken over the
     * signals the invoice carries. An invoice with neither agrees with
     * nothing.
     */
    public double headerAgreement(Invoice invoice, PurchaseOrder candidate) {
        String invoiceVendor = invoice.getVendor() != null ? invoice.getVendor().getName() : null;
        String poVendor = candidate.getVendor() != null ? candidate.getVendor().getName() : null;

        double sum = 0.0;
        int signals = 0;
        if (!isBlank(invoiceVendor)) {
            sum += TextSimilarity.similarity(invoiceVendor, poVendor);
            signals++;
        }
        if (!isBlank(invoice.getPoNumber())) {
            sum += TextSimilarity.sameReference(invoice.getPoNumber(), candidate.getPoNumber()) ? 1.0 : 0.0;
            signals++;
        }
        return signals > 0 ? sum / signals : 0.0;
    }

    /**
     * Highest overall score; on a tie the earlier candidate wins.
     */
    public Optional<CandidateScore> selectBest(List<CandidateScore> scores) {
        CandidateScore best = null;
        for (CandidateScore score : scores) {
            if (best == null || score.getOverallScore() > best.getOverallScore()) {
                best = score;
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean isAccepted(CandidateScore score, MatchingSettings settings) {
        return score != null && score.getOverallScore() >= settings.getAcceptanceThreshold();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
