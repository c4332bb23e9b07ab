package com.example.demo.reconciliation.model;

import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

/**
 * Request containing several invoices to be reconciled independently.
 */
public class BatchReconciliationRequest {

    @NotEmpty(message = "Reconciliations cannot be empty")
    @Valid
    private List<ReconciliationRequest> reconciliations = new ArrayList<>();

    public BatchReconciliationRequest() {
    }

    public BatchReconciliationRequest(List<ReconciliationRequest> reconciliations) {
        this.reconciliations = reconciliations;
    }

    public List<ReconciliationRequest> getReconciliations() {
        return reconciliations;
    }

    public void setReconciliations(List<ReconciliationRequest> reconciliations) {
        this.reconciliations = reconciliations;
    }
}
