package com.example.demo.reconciliation.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response containing one result per invoice of a batch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchReconciliationResponse {

    private List<BatchItemResult> results = new ArrayList<>();

    private BatchSummary summary;

    public BatchReconciliationResponse() {
    }

    public BatchReconciliationResponse(List<BatchItemResult> results, BatchSummary summary) {
        this.results = results;
        this.summary = summary;
    }

    public List<BatchItemResult> getResults() {
        return results;
    }

    public void setResults(List<BatchItemResult> results) {
        this.results = results;
    }

    public BatchSummary getSummary() {
        return summary;
    }

    public void setSummary(BatchSummary summary) {
        this.summary = summary;
    }
}
