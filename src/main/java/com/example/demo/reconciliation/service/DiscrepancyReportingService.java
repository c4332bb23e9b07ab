package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CanonicalIdentifier;
import com.example.demo.reconciliation.model.Discrepancy;
import com.example.demo.reconciliation.model.DiscrepancyKind;
import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.InvoiceLineItem;
import com.example.demo.reconciliation.model.LineItemMatch;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.model.PurchaseOrderLineItem;
import com.example.demo.reconciliation.model.Severity;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Walks a line alignment and reports typed discrepancies.
 * <p>
 * Ordering: header-level issues first, then issues by invoice line number,
 * then issues that only concern a PO line by PO line number. Issues on the
 * same line follow {@link DiscrepancyKind} declaration order.
 */
@Service
public class DiscrepancyReportingService {

    private static final BigDecimal MIN_PRICE_DENOMINATOR = new BigDecimal("0.01");

    private static final Comparator<Discrepancy> REPORT_ORDER = Comparator
            .comparing((Discrepancy d) -> !d.getKind().isHeaderLevel())
            .thenComparing(d -> d.getInvoiceLineNumber() == null)
            .thenComparing(d -> d.getInvoiceLineNumber() != null ? d.getInvoiceLineNumber() : Integer.MAX_VALUE)
            .thenComparing(d -> d.getPoLineNumber() != null ? d.getPoLineNumber() : Integer.MAX_VALUE)
            .thenComparing(Discrepancy::getKind);

    private final NormalizationService normalizationService;

    public DiscrepancyReportingService(NormalizationService normalizationService) {
        this.normalizationService = normalizationService;
    }

    /**
     * @param lineMatches        alignment of the best candidate, empty when
     *                           there was none
     * @param invoice            the invoice
     * @param candidate          best candidate, or null when there was none
     * @param confidentMatch     whether the candidate cleared the acceptance
     *                           threshold
     * @param reconciliationDate date expiry is checked against
     * @param settings           variance thresholds
     * @return issues in report order
     */
    public List<Discrepancy> report(List<LineItemMatch> lineMatches, Invoice invoice, PurchaseOrder candidate,
            boolean confidentMatch, LocalDate reconciliationDate, MatchingSettings settings) {

        List<Discrepancy> issues = new ArrayList<>();

        if (!confidentMatch) {
            issues.add(Discrepancy.header(DiscrepancyKind.NO_CONFIDENT_MATCH, Severity.WARNING,
                    candidate == null
                            ? "No candidate purchase orders found"
                            : String.format("Best candidate %s scored below the acceptance threshold of %.2f",
                                    candidate.getId(), settings.getAcceptanceThreshold())));
        }

        reportSubtotal(invoice, settings, issues);

        Map<Integer, InvoiceLineItem> invoiceLines = indexInvoiceLines(invoice);
        Map<Integer, PurchaseOrderLineItem> poLines = indexPoLines(candidate);
        Map<Integer, Integer> pairedPoLine = new HashMap<>();

        for (LineItemMatch match : lineMatches) {
            if (match.isPaired()) {
                pairedPoLine.put(match.getInvoiceLineNumber(), match.getPoLineNumber());
                InvoiceLineItem invoiceLine = invoiceLines.get(match.getInvoiceLineNumber());
                PurchaseOrderLineItem poLine = poLines.get(match.getPoLineNumber());
                if (invoiceLine != null && poLine != null) {
                    reportPair(invoiceLine, poLine, settings, issues);
                }
            } else if (match.getInvoiceLineNumber() != null) {
                issues.add(new Discrepancy(DiscrepancyKind.UNMATCHED_INVOICE_LINE, Severity.ERROR,
                        match.getInvoiceLineNumber(), null,
                        "Invoice line " + match.getInvoiceLineNumber() + " has no purchase order counterpart"));
            } else if (match.getPoLineNumber() != null) {
                issues.add(new Discrepancy(DiscrepancyKind.UNMATCHED_PO_LINE, Severity.ERROR,
                        null, match.getPoLineNumber(),
                        "Purchase order line " + match.getPoLineNumber() + " was not invoiced"));
            }
        }

        for (InvoiceLineItem line : invoiceLines.values()) {
            Integer poLineNumber = pairedPoLine.get(line.getLineNumber());
            reportLineIntrinsic(line, poLineNumber, reconciliationDate, issues);
        }

        issues.sort(REPORT_ORDER);
        return issues;
    }

    /**
     * Copies of the given matches carrying the kinds reported against their
     * lines.
     */
    public List<LineItemMatch> annotate(List<LineItemMatch> lineMatches, List<Discrepancy> issues) {
        Map<Integer, Set<DiscrepancyKind>> byInvoiceLine = new HashMap<>();
        Map<Integer, Set<DiscrepancyKind>> byPoLineOnly = new HashMap<>();
        for (Discrepancy issue : issues) {
            if (issue.getInvoiceLineNumber() != null) {
                byInvoiceLine.computeIfAbsent(issue.getInvoiceLineNumber(),
                        k -> EnumSet.noneOf(DiscrepancyKind.class)).add(issue.getKind());
            } else if (issue.getPoLineNumber() != null) {
                byPoLineOnly.computeIfAbsent(issue.getPoLineNumber(),
                        k -> EnumSet.noneOf(DiscrepancyKind.class)).add(issue.getKind());
            }
        }

        return lineMatches.stream()
                .map(match -> match.getInvoiceLineNumber() != null
                        ? match.withIssues(byInvoiceLine.get(match.getInvoiceLineNumber()))
                        : match.withIssues(byPoLineOnly.get(match.getPoLineNumber())))
                .collect(Collectors.toList());
    }

    private void reportPair(InvoiceLineItem invoiceLine, PurchaseOrderLineItem poLine, MatchingSettings settings,
            List<Discrepancy> issues) {

        int invoiceLineNumber = invoiceLine.getLineNumber();
        int poLineNumber = poLine.getLineNumber();

        int invoiceQuantity = invoiceLine.getQuantity() != null ? invoiceLine.getQuantity() : 0;
        int poQuantity = poLine.getQuantity() != null ? poLine.getQuantity() : 0;
        if (invoiceQuantity != poQuantity) {
            double variance = (double) Math.abs(invoiceQuantity - poQuantity) / Math.max(poQuantity, 1);
            issues.add(new Discrepancy(DiscrepancyKind.QUANTITY_MISMATCH,
                    variance > settings.getErrorVarianceThreshold() ? Severity.ERROR : Severity.WARNING,
                    invoiceLineNumber, poLineNumber,
                    String.format("Invoiced quantity %d differs from ordered quantity %d (%.1f%%)",
                            invoiceQuantity, poQuantity, variance * 100)));
        }

        BigDecimal invoicePrice = invoiceLine.getUnitPrice() != null ? invoiceLine.getUnitPrice() : BigDecimal.ZERO;
        BigDecimal poPrice = poLine.getUnitPrice() != null ? poLine.getUnitPrice() : BigDecimal.ZERO;
        double priceVariance = invoicePrice.subtract(poPrice).abs()
                .divide(poPrice.max(MIN_PRICE_DENOMINATOR), MathContext.DECIMAL64)
                .doubleValue();
        if (priceVariance > settings.getPriceVarianceTolerance()) {
            issues.add(new Discrepancy(DiscrepancyKind.PRICE_VARIANCE,
                    priceVariance > settings.getErrorVarianceThreshold() ? Severity.ERROR : Severity.WARNING,
                    invoiceLineNumber, poLineNumber,
                    String.format("Invoiced unit price %s differs from ordered price %s (%.1f%%)",
                            invoicePrice.toPlainString(), poPrice.toPlainString(), priceVariance * 100)));
        }

        if (!isBlank(invoiceLine.getIdentifier()) && !isBlank(poLine.getIdentifier())) {
            CanonicalIdentifier invoiceId = normalizationService.normalizeIdentifier(invoiceLine.getIdentifier());
            CanonicalIdentifier poId = normalizationService.normalizeIdentifier(poLine.getIdentifier());
            if (!invoiceId.getValue().trim().equals(poId.getValue().trim())) {
                issues.add(new Discrepancy(DiscrepancyKind.IDENTIFIER_MISMATCH, Severity.WARNING,
                        invoiceLineNumber, poLineNumber,
                        String.format("Invoice identifier %s does not match ordered identifier %s",
                                invoiceId.getValue(), poId.getValue())));
            }
        }

        String poLot = normalizationService.normalizeLot(poLine.getLotNumber());
        if (poLot != null) {
            String invoiceLot = normalizationService.normalizeLot(invoiceLine.getLotNumber());
            if (!poLot.equals(invoiceLot)) {
                issues.add(new Discrepancy(DiscrepancyKind.LOT_MISMATCH, Severity.WARNING,
                        invoiceLineNumber, poLineNumber,
                        String.format("Invoiced lot %s differs from ordered lot %s",
                                invoiceLine.getLotNumber(), poLine.getLotNumber())));
            }
        }
    }

    private void reportLineIntrinsic(InvoiceLineItem line, Integer poLineNumber, LocalDate reconciliationDate,
            List<Discrepancy> issues) {

        if (!isBlank(line.getIdentifier())
                && !normalizationService.normalizeIdentifier(line.getIdentifier()).isRecognized()) {
            issues.add(new Discrepancy(DiscrepancyKind.UNRECOGNIZED_IDENTIFIER, Severity.INFO,
                    line.getLineNumber(), poLineNumber,
                    "Identifier '" + line.getIdentifier() + "' is neither an NDC nor a GTIN"));
        }

        LocalDate expiry = normalizationService.normalizeDate(line.getExpiryDate());
        if (expiry != null && reconciliationDate != null && expiry.isBefore(reconciliationDate)) {
            issues.add(new Discrepancy(DiscrepancyKind.LOT_EXPIRED, Severity.ERROR,
                    line.getLineNumber(), poLineNumber,
                    String.format("Lot %s expired on %s", line.getLotNumber(), expiry)));
        }
    }

    private void reportSubtotal(Invoice invoice, MatchingSettings settings, List<Discrepancy> issues) {
        if (invoice.getTotals() == null || invoice.getTotals().getSubtotal() == null || invoice.getItems() == null) {
            return;
        }
        BigDecimal declared = invoice.getTotals().getSubtotal();
        BigDecimal computed = BigDecimal.ZERO;
        for (InvoiceLineItem item : invoice.getItems()) {
            computed = computed.add(lineTotal(item));
        }
        double difference = computed.subtract(declared).abs().doubleValue();
        double tolerance = Math.max(settings.getSubtotalAbsoluteTolerance(),
                declared.abs().doubleValue() * settings.getSubtotalRelativeTolerance());
        if (difference > tolerance) {
            issues.add(Discrepancy.header(DiscrepancyKind.SUBTOTAL_MISMATCH, Severity.INFO,
                    String.format("Line totals add up to %s but the declared subtotal is %s",
                            computed.toPlainString(), declared.toPlainString())));
        }
    }

    private static BigDecimal lineTotal(InvoiceLineItem item) {
        if (item.getTotalPrice() != null) {
            return item.getTotalPrice();
        }
        if (item.getUnitPrice() != null && item.getQuantity() != null) {
            return item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity()));
        }
        return BigDecimal.ZERO;
    }

    private static Map<Integer, InvoiceLineItem> indexInvoiceLines(Invoice invoice) {
        Map<Integer, InvoiceLineItem> index = new TreeMap<>();
        if (invoice.getItems() != null) {
            for (InvoiceLineItem item : invoice.getItems()) {
                index.put(item.getLineNumber(), item);
            }
        }
        return index;
    }

    private static Map<Integer, PurchaseOrderLineItem> indexPoLines(PurchaseOrder candidate) {
        Map<Integer, PurchaseOrderLineItem> index = new HashMap<>();
        if (candidate != null && candidate.getItems() != null) {
            for (PurchaseOrderLineItem item : candidate.getItems()) {
                if (item != null && item.getLineNumber() != null) {
                    index.putIfAbsent(item.getLineNumber(), item);
                }
            }
        }
        return index;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
