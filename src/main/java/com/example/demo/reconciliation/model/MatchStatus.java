package com.example.demo.reconciliation.model;

/**
 * Outcome of a reconciliation for the caller's workflow.
 */
public enum MatchStatus {
    /** A purchase order cleared the acceptance threshold. */
    MATCHED,
    /** No confident match, or issues that a reviewer has to look at. */
    NEEDS_REVIEW
}
