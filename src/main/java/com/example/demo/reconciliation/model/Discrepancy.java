package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single reported issue. Line numbers refer back to the input documents by
 * value; either may be null depending on the kind.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Discrepancy {

    private final DiscrepancyKind kind;
    private final Severity severity;
    private final Integer invoiceLineNumber;
    private final Integer poLineNumber;
    private final String detail;

    public Discrepancy(DiscrepancyKind kind, Severity severity, Integer invoiceLineNumber,
            Integer poLineNumber, String detail) {
        this.kind = kind;
        this.severity = severity;
        this.invoiceLineNumber = invoiceLineNumber;
        this.poLineNumber = poLineNumber;
        this.detail = detail;
    }

    public static Discrepancy header(DiscrepancyKind kind, Severity severity, String detail) {
        return new Discrepancy(kind, severity, null, null, detail);
    }

    public DiscrepancyKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Integer getInvoiceLineNumber() {
        return invoiceLineNumber;
    }

    public Integer getPoLineNumber() {
        return poLineNumber;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Discrepancy)) {
            return false;
        }
        Discrepancy that = (Discrepancy) o;
        return kind == that.kind
                && severity == that.severity
                && Objects.equals(invoiceLineNumber, that.invoiceLineNumber)
                && Objects.equals(poLineNumber, that.poLineNumber)
                && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, severity, invoiceLineNumber, poLineNumber, detail);
    }

    @Override
    public String toString() {
        return kind.getCode() + "[" + severity.toJson() + "] invoiceLine=" + invoiceLineNumber
                + " poLine=" + poLineNumber + ": " + detail;
    }
}
