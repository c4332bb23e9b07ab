package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CanonicalIdentifier;
import com.example.demo.reconciliation.model.InvoiceLineItem;
import com.example.demo.reconciliation.model.LineItemMatch;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.PurchaseOrderLineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Aligns invoice lines with purchase order lines.
 * <p>
 * Every (invoice line, PO line) pair gets a similarity in [0, 1] from four
 * weighted field scores: identifier, lot, quantity and unit price. Pairs are
 * then assigned greedily, best similarity first, and assignment stops at the
 * configured floor so weak pairs stay unmatched instead of being forced
 * together. Ties go to the smaller invoice line number, then the smaller PO
 * line number.
 */
@Service
public class LineItemMatchingService {

    private static final Logger logger = LoggerFactory.getLogger(LineItemMatchingService.class);

    private static final BigDecimal MIN_PRICE_DENOMINATOR = new BigDecimal("0.01");

    private final NormalizationService normalizationService;

    public LineItemMatchingService(NormalizationService normalizationService) {
        this.normalizationService = normalizationService;
    }

    /**
     * Aligns the two line sets. Inputs are copied and never modified. Lines
     * without a line number cannot be reported on and are left out.
     *
     * @return invoice lines in line-number order (paired or unmatched), followed
     *         by unmatched PO lines in line-number order
     */
    public List<LineItemMatch> align(List<InvoiceLineItem> invoiceItems, List<PurchaseOrderLineItem> poItems,
            MatchingSettings settings) {

        List<InvoiceLineItem> invoiceLines = sortedCopy(invoiceItems, InvoiceLineItem::getLineNumber);
        List<PurchaseOrderLineItem> poLines = sortedCopy(poItems, PurchaseOrderLineItem::getLineNumber);

        int rows = invoiceLines.size();
        int cols = poLines.size();

        List<PairCandidate> pairs = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                double similarity = pairSimilarity(invoiceLines.get(i), poLines.get(j), settings);
                if (similarity >= settings.getPairFloor()) {
                    pairs.add(new PairCandidate(i, j, similarity,
                            invoiceLines.get(i).getLineNumber(), poLines.get(j).getLineNumber()));
                }
            }
        }

        pairs.sort(Comparator.comparingDouble((PairCandidate p) -> -p.similarity)
                .thenComparingInt(p -> p.invoiceLineNumber)
                .thenComparingInt(p -> p.poLineNumber));

        int[] assignedPo = new int[rows];
        double[] assignedSimilarity = new double[rows];
        boolean[] poTaken = new boolean[cols];
        Arrays.fill(assignedPo, -1);

        int matched = 0;
        for (PairCandidate pair : pairs) {
            if (matched == Math.min(rows, cols)) {
                break;
            }
            if (assignedPo[pair.row] >= 0 || poTaken[pair.col]) {
                continue;
            }
            assignedPo[pair.row] = pair.col;
            assignedSimilarity[pair.row] = pair.similarity;
            poTaken[pair.col] = true;
            matched++;
        }

        List<LineItemMatch> result = new ArrayList<>(rows + cols);
        for (int i = 0; i < rows; i++) {
            int invoiceLineNumber = invoiceLines.get(i).getLineNumber();
            if (assignedPo[i] >= 0) {
                result.add(LineItemMatch.matched(invoiceLineNumber,
                        poLines.get(assignedPo[i]).getLineNumber(), assignedSimilarity[i]));
            } else {
                result.add(LineItemMatch.unmatchedInvoiceLine(invoiceLineNumber));
            }
        }
        for (int j = 0; j < cols; j++) {
            if (!poTaken[j]) {
                result.add(LineItemMatch.unmatchedPoLine(poLines.get(j).getLineNumber()));
            }
        }

        logger.debug("Aligned {} invoice lines with {} PO lines: {} pairs above floor {}, {} assigned",
                rows, cols, pairs.size(), settings.getPairFloor(), matched);

        return result;
    }

    /**
     * Weighted similarity of one invoice line and one PO line. When the PO line
     * pins no lot, the lot term is left out and the other weights are rescaled.
     */
    public double pairSimilarity(InvoiceLineItem invoiceLine, PurchaseOrderLineItem poLine,
            MatchingSettings settings) {

        double weighted = 0.0;
        double totalWeight = 0.0;

        weighted += settings.getIdentifierWeight() * identifierScore(invoiceLine, poLine, settings);
        totalWeight += settings.getIdentifierWeight();

        String poLot = normalizationService.normalizeLot(poLine.getLotNumber());
        if (poLot != null) {
            String invoiceLot = normalizationService.normalizeLot(invoiceLine.getLotNumber());
            weighted += settings.getLotWeight() * (poLot.equals(invoiceLot) ? 1.0 : 0.0);
            totalWeight += settings.getLotWeight();
        }

        weighted += settings.getQuantityWeight() * quantityScore(invoiceLine.getQuantity(), poLine.getQuantity());
        totalWeight += settings.getQuantityWeight();

        weighted += settings.getPriceWeight() * priceScore(invoiceLine.getUnitPrice(), poLine.getUnitPrice());
        totalWeight += settings.getPriceWeight();

        if (totalWeight <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, weighted / totalWeight));
    }

    double identifierScore(InvoiceLineItem invoiceLine, PurchaseOrderLineItem poLine, MatchingSettings settings) {
        CanonicalIdentifier invoiceId = normalizationService.normalizeIdentifier(invoiceLine.getIdentifier());
        CanonicalIdentifier poId = normalizationService.normalizeIdentifier(poLine.getIdentifier());

        if (invoiceId.sameProductAs(poId)) {
            return 1.0;
        }
        if (!invoiceId.isRecognized() && !poId.isRecognized() && !invoiceId.isBlank() && !poId.isBlank()
                && invoiceId.getValue().trim().equals(poId.getValue().trim())) {
            return 1.0;
        }
        if (!invoiceId.isRecognized() || !poId.isRecognized()) {
            double descriptionSimilarity = TextSimilarity.similarity(
                    invoiceLine.getDescription(), poLine.getDescription());
            if (descriptionSimilarity >= settings.getDescriptionSimilarityThreshold()) {
                return settings.getIdentifierFallbackCredit();
            }
        }
        return 0.0;
    }

    static double quantityScore(Integer invoiceQuantity, Integer poQuantity) {
        int qi = invoiceQuantity != null ? invoiceQuantity : 0;
        int qp = poQuantity != null ? poQuantity : 0;
        double relative = (double) Math.abs(qi - qp) / Math.max(qp, 1);
        return 1.0 - Math.min(1.0, relative);
    }

    static double priceScore(BigDecimal invoicePrice, BigDecimal poPrice) {
        BigDecimal pi = invoicePrice != null ? invoicePrice : BigDecimal.ZERO;
        BigDecimal pp = poPrice != null ? poPrice : BigDecimal.ZERO;
        BigDecimal denominator = pp.max(MIN_PRICE_DENOMINATOR);
        double relative = pi.subtract(pp).abs().divide(denominator, MathContext.DECIMAL64).doubleValue();
        return 1.0 - Math.min(1.0, relative);
    }

    private static <T> List<T> sortedCopy(List<T> items, Function<T, Integer> lineNumber) {
        if (items == null) {
            return new ArrayList<>();
        }
        return items.stream()
                .filter(item -> item != null && lineNumber.apply(item) != null)
                .sorted(Comparator.comparing(lineNumber))
                .collect(Collectors.toList());
    }

    private static class PairCandidate {
        final int row;
        final int col;
        final double similarity;
        final int invoiceLineNumber;
        final int poLineNumber;

        PairCandidate(int row, int col, double similarity, int invoiceLineNumber, int poLineNumber) {
            this.row = row;
            this.col = col;
            this.similarity = similarity;
            this.invoiceLineNumber = invoiceLineNumber;
            this.poLineNumber = poLineNumber;
        }
    }
}
