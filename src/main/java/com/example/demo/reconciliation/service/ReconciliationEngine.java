package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CandidateScore;
import com.example.demo.reconciliation.model.Discrepancy;
import com.example.demo.reconciliation.model.Invoice;
import com.example.demo.reconciliation.model.InvoiceLineItem;
import com.example.demo.reconciliation.model.LineItemMatch;
import com.example.demo.reconciliation.model.MatchResult;
import com.example.demo.reconciliation.model.MatchStatus;
import com.example.demo.reconciliation.model.MatchingSettings;
import com.example.demo.reconciliation.model.PurchaseOrder;
import com.example.demo.reconciliation.model.PurchaseOrderLineItem;
import com.example.demo.reconciliation.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles one invoice against its candidate purchase orders.
 * <p>
 * Stateless: every call works on its own copies of the inputs and returns a
 * fresh {@link MatchResult}, so calls may run concurrently without locking.
 * The only blocking step is the candidate lookup.
 */
@Service
public class ReconciliationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final CandidateSelectionService candidateSelectionService;
    private final LineItemMatchingService lineItemMatchingService;
    private final ScoringService scoringService;
    private final DiscrepancyReportingService discrepancyReportingService;
    private final Clock clock;

    public ReconciliationEngine(
            CandidateSelectionService candidateSelectionService,
            LineItemMatchingService lineItemMatchingService,
            ScoringService scoringService,
            DiscrepancyReportingService discrepancyReportingService,
            Clock clock) {
        this.candidateSelectionService = candidateSelectionService;
        this.lineItemMatchingService = lineItemMatchingService;
        this.scoringService = scoringService;
        this.discrepancyReportingService = discrepancyReportingService;
        this.clock = clock;
    }

    /**
     * Reconcile with expiry checked against today's date.
     */
    public MatchResult reconcile(Invoice invoice, List<String> explicitPoIds, MatchingSettings settings) {
        return reconcile(invoice, explicitPoIds, null, settings);
    }

    /**
     * Validates the invoice, selects candidates and reconciles against them.
     *
     * @param invoice            extracted invoice
     * @param explicitPoIds      purchase orders chosen upstream; empty to look
     *                           candidates up by PO number and vendor
     * @param reconciliationDate date for expiry checks, null for today
     * @param settings           weights and thresholds for this call
     * @throws InvalidInvoiceException when the invoice is malformed
     */
    public MatchResult reconcile(Invoice invoice, List<String> explicitPoIds, LocalDate reconciliationDate,
            MatchingSettings settings) {

        validateInvoice(invoice);

        List<String> ids = explicitPoIds != null ? List.copyOf(explicitPoIds) : Collections.emptyList();
        List<PurchaseOrder> candidates = candidateSelectionService.selectCandidates(invoice, ids, settings);

        return reconcileValidated(invoice, candidates, reconciliationDate, settings);
    }

    /**
     * Reconciles against an already selected candidate list.
     *
     * @throws InvalidInvoiceException when the invoice is malformed
     */
    public MatchResult reconcileAgainst(Invoice invoice, List<PurchaseOrder> candidates,
            LocalDate reconciliationDate, MatchingSettings settings) {

        validateInvoice(invoice);
        return reconcileValidated(invoice, candidates, reconciliationDate, settings);
    }

    private MatchResult reconcileValidated(Invoice invoice, List<PurchaseOrder> candidates,
            LocalDate reconciliationDate, MatchingSettings settings) {

        LocalDate date = reconciliationDate != null ? reconciliationDate : LocalDate.now(clock);
        List<InvoiceLineItem> invoiceItems = List.copyOf(invoice.getItems());

        logger.info("Reconciling invoice {} ({} lines) against {} candidate purchase orders",
                invoice.getInvoiceNumber(), invoiceItems.size(), candidates.size());

        List<CandidateScore> scores = new ArrayList<>();
        for (PurchaseOrder loaded : candidates) {
            PurchaseOrder candidate = withUsableLines(loaded);
            List<LineItemMatch> lineMatches = lineItemMatchingService.align(
                    invoiceItems, candidate.getItems(), settings);
            CandidateScore score = scoringService.score(invoice, candidate, lineMatches, settings);
            logger.debug("Invoice {}: {}", invoice.getInvoiceNumber(), score);
            scores.add(score);
        }

        Optional<CandidateScore> best = scoringService.selectBest(scores);
        boolean accepted = best.isPresent() && scoringService.isAccepted(best.get(), settings);

        PurchaseOrder bestCandidate = best.map(CandidateScore::getPurchaseOrder).orElse(null);
        List<LineItemMatch> lineMatches = best.map(CandidateScore::getLineMatches).orElse(Collections.emptyList());
        double matchScore = best.map(CandidateScore::getOverallScore).orElse(0.0);

        List<Discrepancy> issues = discrepancyReportingService.report(
                lineMatches, invoice, bestCandidate, accepted, date, settings);
        List<LineItemMatch> annotated = discrepancyReportingService.annotate(lineMatches, issues);

        boolean hasErrors = issues.stream().anyMatch(issue -> issue.getSeverity() == Severity.ERROR);
        MatchStatus status = accepted && !hasErrors ? MatchStatus.MATCHED : MatchStatus.NEEDS_REVIEW;

        if (accepted) {
            logger.info("Invoice {} matched purchase order {} (score {}, {} issues)",
                    invoice.getInvoiceNumber(), bestCandidate.getId(), String.format("%.4f", matchScore),
                    issues.size());
        } else {
            logger.warn("Invoice {} has no confident match (best score {}); flagged for review",
                    invoice.getInvoiceNumber(), String.format("%.4f", matchScore));
        }

        return new MatchResult(
                invoice.getInvoiceNumber(),
                accepted ? bestCandidate.getId() : null,
                matchScore,
                status,
                date,
                annotated,
                issues);
    }

    /**
     * Copy of the purchase order keeping only lines that can be told apart:
     * lines without a line number are dropped, and of several lines sharing a
     * number only the first is kept.
     */
    static PurchaseOrder withUsableLines(PurchaseOrder purchaseOrder) {
        List<PurchaseOrderLineItem> usable = new ArrayList<>();
        if (purchaseOrder.getItems() != null) {
            Set<Integer> lineNumbers = new HashSet<>();
            for (PurchaseOrderLineItem item : purchaseOrder.getItems()) {
                if (item == null || item.getLineNumber() == null) {
                    logger.warn("Purchase order {}: ignoring line without a line number", purchaseOrder.getId());
                } else if (!lineNumbers.add(item.getLineNumber())) {
                    logger.warn("Purchase order {}: ignoring duplicate line number {}",
                            purchaseOrder.getId(), item.getLineNumber());
                } else {
                    usable.add(item);
                }
            }
        }
        PurchaseOrder copy = new PurchaseOrder(purchaseOrder.getId(), purchaseOrder.getPoNumber(),
                purchaseOrder.getVendor(), usable);
        copy.setStatus(purchaseOrder.getStatus());
        return copy;
    }

    /**
     * Rejects malformed invoices before any matching starts. All violations are
     * collected into one exception.
     */
    public void validateInvoice(Invoice invoice) {
        List<String> violations = new ArrayList<>();

        if (invoice == null) {
            throw new InvalidInvoiceException(null, List.of("Invoice is required"));
        }
        if (invoice.getInvoiceNumber() == null || invoice.getInvoiceNumber().trim().isEmpty()) {
            violations.add("Invoice number is required");
        }
        if (invoice.getItems() == null) {
            violations.add("Items are required");
        } else {
            Set<Integer> lineNumbers = new HashSet<>();
            for (int i = 0; i < invoice.getItems().size(); i++) {
                InvoiceLineItem item = invoice.getItems().get(i);
                if (item == null) {
                    violations.add("items[" + i + "]: line item is required");
                    continue;
                }
                String ref = "items[" + i + "]";
                if (item.getLineNumber() == null) {
                    violations.add(ref + ": line number is required");
                } else if (!lineNumbers.add(item.getLineNumber())) {
                    violations.add(ref + ": duplicate line number " + item.getLineNumber());
                }
                if (item.getQuantity() == null) {
                    violations.add(ref + ": quantity is required");
                } else if (item.getQuantity() < 0) {
                    violations.add(ref + ": quantity cannot be negative");
                }
                if (item.getUnitPrice() == null) {
                    violations.add(ref + ": unit price is required");
                } else if (item.getUnitPrice().compareTo(BigDecimal.ZERO) < 0) {
                    violations.add(ref + ": unit price cannot be negative");
                }
                if (item.getTotalPrice() != null && item.getTotalPrice().compareTo(BigDecimal.ZERO) < 0) {
                    violations.add(ref + ": total price cannot be negative");
                }
            }
        }

        if (!violations.isEmpty()) {
            logger.warn("Rejected invoice {}: {}", invoice.getInvoiceNumber(), violations);
            throw new InvalidInvoiceException(invoice.getInvoiceNumber(), violations);
        }
    }

    /**
     * Malformed invoice input. Raised before matching begins, never for a
     * low-confidence outcome.
     */
    public static class InvalidInvoiceException extends RuntimeException {
        private final String invoiceNumber;
        private final List<String> violations;

        public InvalidInvoiceException(String invoiceNumber, List<String> violations) {
            super("Invalid invoice" + (invoiceNumber != null ? " " + invoiceNumber : "") + ": "
                    + String.join("; ", violations));
            this.invoiceNumber = invoiceNumber;
            this.violations = List.copyOf(violations);
        }

        public String getInvoiceNumber() {
            return invoiceNumber;
        }

        public List<String> getViolations() {
            return violations;
        }
    }
}
