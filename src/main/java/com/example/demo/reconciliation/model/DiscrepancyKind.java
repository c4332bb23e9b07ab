package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrepancy kinds in reporting order. Header-level kinds come first; within
 * one line, issues are ordered by declaration order.
 */
public enum DiscrepancyKind {
    NO_CONFIDENT_MATCH("no-confident-match", true),
    SUBTOTAL_MISMATCH("subtotal-mismatch", true),
    QUANTITY_MISMATCH("quantity-mismatch", false),
    PRICE_VARIANCE("price-variance", false),
    IDENTIFIER_MISMATCH("identifier-mismatch", false),
    LOT_MISMATCH("lot-mismatch", false),
    UNRECOGNIZED_IDENTIFIER("unrecognized-identifier", false),
    LOT_EXPIRED("lot-expired", false),
    UNMATCHED_INVOICE_LINE("unmatched-invoice-line", false),
    UNMATCHED_PO_LINE("unmatched-po-line", false);

    private final String code;
    private final boolean headerLevel;

    DiscrepancyKind(String code, boolean headerLevel) {
        this.code = code;
        this.headerLevel = headerLevel;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isHeaderLevel() {
        return headerLevel;
    }
}
