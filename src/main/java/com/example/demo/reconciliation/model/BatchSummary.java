package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Summary of a batch reconciliation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchSummary {

    private int totalInvoices;
    private int completedInvoices;
    private int failedInvoices;
    private int timeoutInvoices;
    private int matchedInvoices;
    private int needsReviewInvoices;
    private long totalProcessingTimeMs;

    public BatchSummary() {
    }

    public BatchSummary(int totalInvoices, int completedInvoices, int failedInvoices, int timeoutInvoices,
            int matchedInvoices, int needsReviewInvoices, long totalProcessingTimeMs) {
        this.totalInvoices = totalInvoices;
        this.completedInvoices = completedInvoices;
        this.failedInvoices = failedInvoices;
        this.timeoutInvoices = timeoutInvoices;
        this.matchedInvoices = matchedInvoices;
        this.needsReviewInvoices = needsReviewInvoices;
        this.totalProcessingTimeMs = totalProcessingTimeMs;
    }

    // Getters and setters
    public int getTotalInvoices() {
        return totalInvoices;
    }

    public void setTotalInvoices(int totalInvoices) {
        this.totalInvoices = totalInvoices;
    }

    public int getCompletedInvoices() {
        return completedInvoices;
    }

    public void setCompletedInvoices(int completedInvoices) {
        this.completedInvoices = completedInvoices;
    }

    public int getFailedInvoices() {
        return failedInvoices;
    }

    public void setFailedInvoices(int failedInvoices) {
        this.failedInvoices = failedInvoices;
    }

    public int getTimeoutInvoices() {
        return timeoutInvoices;
    }

    public void setTimeoutInvoices(int timeoutInvoices) {
        this.timeoutInvoices = timeoutInvoices;
    }

    public int getMatchedInvoices() {
        return matchedInvoices;
    }

    public void setMatchedInvoices(int matchedInvoices) {
        this.matchedInvoices = matchedInvoices;
    }

    public int getNeedsReviewInvoices() {
        return needsReviewInvoices;
    }

    public void setNeedsReviewInvoices(int needsReviewInvoices) {
        this.needsReviewInvoices = needsReviewInvoices;
    }

    public long getTotalProcessingTimeMs() {
        return totalProcessingTimeMs;
    }

    public void setTotalProcessingTimeMs(long totalProcessingTimeMs) {
        this.totalProcessingTimeMs = totalProcessingTimeMs;
    }
}
