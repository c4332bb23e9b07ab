package com.example.demo.reconciliation.model;

public enum BatchItemStatus {
    COMPLETED,
    FAILED,
    TIMEOUT
}
