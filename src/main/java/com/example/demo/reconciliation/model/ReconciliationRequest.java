package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request to reconcile one invoice.
 */
public class ReconciliationRequest {

    @NotNull(message = "Invoice is required")
    @Valid
    private Invoice invoice;

    /**
     * Purchase orders already identified by a reviewer or upstream step. When
     * empty, candidates are looked up by PO number and vendor.
     */
    private List<String> purchaseOrderIds = new ArrayList<>();

    /**
     * Date expiry checks are evaluated against. Defaults to today.
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate reconciliationDate;

    public ReconciliationRequest() {
    }

    public ReconciliationRequest(Invoice invoice, List<String> purchaseOrderIds) {
        this.invoice = invoice;
        this.purchaseOrderIds = purchaseOrderIds;
    }

    public Invoice getInvoice() {
        return invoice;
    }

    public void setInvoice(Invoice invoice) {
        this.invoice = invoice;
    }

    public List<String> getPurchaseOrderIds() {
        return purchaseOrderIds;
    }

    public void setPurchaseOrderIds(List<String> purchaseOrderIds) {
        this.purchaseOrderIds = purchaseOrderIds;
    }

    public LocalDate getReconciliationDate() {
        return reconciliationDate;
    }

    public void setReconciliationDate(LocalDate reconciliationDate) {
        this.reconciliationDate = reconciliationDate;
    }
}
