package com.example.demo.reconciliation.model;

/**
 * Shape an identifier was recognized as. {@link #UNKNOWN} marks input that did
 * not parse into any known shape.
 */
public enum IdentifierKind {
    NDC,
    GTIN,
    UNKNOWN
}
