package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchItemResult {
    private String invoiceNumber;
    private BatchItemStatus status;
    private MatchResult result;
    private String errorMessage;
    private Long processingTimeMs;

    public BatchItemResult() {
    }

    public BatchItemResult(String invoiceNumber, BatchItemStatus status) {
        this.invoiceNumber = invoiceNumber;
        this.status = status;
    }

    public static BatchItemResult completed(String invoiceNumber, MatchResult result, long processingTimeMs) {
        BatchItemResult item = new BatchItemResult(invoiceNumber, BatchItemStatus.COMPLETED);
        item.setResult(result);
        item.setProcessingTimeMs(processingTimeMs);
        return item;
    }

    public static BatchItemResult failure(String invoiceNumber, String errorMessage) {
        BatchItemResult item = new BatchItemResult(invoiceNumber, BatchItemStatus.FAILED);
        item.setErrorMessage(errorMessage);
        return item;
    }

    public static BatchItemResult timeout(String invoiceNumber) {
        BatchItemResult item = new BatchItemResult(invoiceNumber, BatchItemStatus.TIMEOUT);
        item.setErrorMessage("Reconciliation did not complete in time");
        return item;
    }

    // Getters and setters
    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public void setInvoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
    }

    public BatchItemStatus getStatus() {
        return status;
    }

    public void setStatus(BatchItemStatus status) {
        this.status = status;
    }

    public MatchResult getResult() {
        return result;
    }

    public void setResult(MatchResult result) {
        this.result = result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(Long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }
}
