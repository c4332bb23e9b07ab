package com.example.demo.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    INFO,
    WARNING,
    ERROR;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
