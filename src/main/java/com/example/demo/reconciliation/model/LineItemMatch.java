package com.example.demo.reconciliation.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Pairing of one invoice line with one PO line. A null invoice line number
 * marks an unmatched PO line and vice versa.
 */
public final class LineItemMatch {

    private final Integer invoiceLineNumber;
    private final Integer poLineNumber;
    private final double similarity;
    private final Set<DiscrepancyKind> issues;

    public LineItemMatch(Integer invoiceLineNumber, Integer poLineNumber, double similarity,
            Set<DiscrepancyKind> issues) {
        this.invoiceLineNumber = invoiceLineNumber;
        this.poLineNumber = poLineNumber;
        this.similarity = similarity;
        this.issues = issues == null || issues.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(issues));
    }

    public static LineItemMatch matched(int invoiceLineNumber, int poLineNumber, double similarity) {
        return new LineItemMatch(invoiceLineNumber, poLineNumber, similarity, null);
    }

    public static LineItemMatch unmatchedInvoiceLine(int invoiceLineNumber) {
        return new LineItemMatch(invoiceLineNumber, null, 0.0,
                EnumSet.of(DiscrepancyKind.UNMATCHED_INVOICE_LINE));
    }

    public static LineItemMatch unmatchedPoLine(int poLineNumber) {
        return new LineItemMatch(null, poLineNumber, 0.0,
                EnumSet.of(DiscrepancyKind.UNMATCHED_PO_LINE));
    }

    /**
     * Copy of this match carrying the given issue kinds in addition to its own.
     */
    public LineItemMatch withIssues(Set<DiscrepancyKind> additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        EnumSet<DiscrepancyKind> merged = EnumSet.copyOf(additional);
        merged.addAll(issues);
        return new LineItemMatch(invoiceLineNumber, poLineNumber, similarity, merged);
    }

    public boolean isPaired() {
        return invoiceLineNumber != null && poLineNumber != null;
    }

    public Integer getInvoiceLineNumber() {
        return invoiceLineNumber;
    }

    public Integer getPoLineNumber() {
        return poLineNumber;
    }

    public double getSimilarity() {
        return similarity;
    }

    public Set<DiscrepancyKind> getIssues() {
        return issues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineItemMatch)) {
            return false;
        }
        LineItemMatch that = (LineItemMatch) o;
        return Double.compare(similarity, that.similarity) == 0
                && Objects.equals(invoiceLineNumber, that.invoiceLineNumber)
                && Objects.equals(poLineNumber, that.poLineNumber)
                && issues.equals(that.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invoiceLineNumber, poLineNumber, similarity, issues);
    }

    @Override
    public String toString() {
        return String.format("LineItemMatch{invoiceLine=%s, poLine=%s, similarity=%.4f, issues=%s}",
                invoiceLineNumber, poLineNumber, similarity, issues);
    }
}
