package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Result of reconciling one invoice. Holds no references into the input
 * documents beyond line numbers and ids.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({ "invoiceNumber", "matchedPurchaseOrderId", "matchScore", "status",
        "reconciliationDate", "lineItemMatches", "issues" })
public final class MatchResult {

    private final String invoiceNumber;
    private final String matchedPurchaseOrderId;
    private final double matchScore;
    private final MatchStatus status;
    private final LocalDate reconciliationDate;
    private final List<LineItemMatch> lineItemMatches;
    private final List<Discrepancy> issues;

    public MatchResult(String invoiceNumber, String matchedPurchaseOrderId, double matchScore,
            MatchStatus status, LocalDate reconciliationDate,
            List<LineItemMatch> lineItemMatches, List<Discrepancy> issues) {
        this.invoiceNumber = invoiceNumber;
        this.matchedPurchaseOrderId = matchedPurchaseOrderId;
        this.matchScore = matchScore;
        this.status = status;
        this.reconciliationDate = reconciliationDate;
        this.lineItemMatches = List.copyOf(lineItemMatches);
        this.issues = List.copyOf(issues);
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public String getMatchedPurchaseOrderId() {
        return matchedPurchaseOrderId;
    }

    public double getMatchScore() {
        return matchScore;
    }

    public MatchStatus getStatus() {
        return status;
    }

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    public LocalDate getReconciliationDate() {
        return reconciliationDate;
    }

    public List<LineItemMatch> getLineItemMatches() {
        return lineItemMatches;
    }

    public List<Discrepancy> getIssues() {
        return issues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MatchResult)) {
            return false;
        }
        MatchResult that = (MatchResult) o;
        return Double.compare(matchScore, that.matchScore) == 0
                && Objects.equals(invoiceNumber, that.invoiceNumber)
                && Objects.equals(matchedPurchaseOrderId, that.matchedPurchaseOrderId)
                && status == that.status
                && Objects.equals(reconciliationDate, that.reconciliationDate)
                && lineItemMatches.equals(that.lineItemMatches)
                && issues.equals(that.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invoiceNumber, matchedPurchaseOrderId, matchScore, status,
                reconciliationDate, lineItemMatches, issues);
    }
}
