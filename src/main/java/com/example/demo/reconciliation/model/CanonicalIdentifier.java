package com.example.demo.reconciliation.model;

import java.util.Objects;

/**
 * Product identifier after normalization. For {@code NDC} and {@code GTIN}
 * the value is the hyphenated 5-4-2 NDC; for {@code UNKNOWN} it is the raw
 * input, unchanged.
 */
public final class CanonicalIdentifier {

    private final IdentifierKind kind;
    private final String value;
    private final String raw;
    private final boolean lowConfidence;

    private CanonicalIdentifier(IdentifierKind kind, String value, String raw, boolean lowConfidence) {
        this.kind = kind;
        this.value = value;
        this.raw = raw;
        this.lowConfidence = lowConfidence;
    }

    public static CanonicalIdentifier ndc(String canonicalNdc, String raw) {
        return new CanonicalIdentifier(IdentifierKind.NDC, canonicalNdc, raw, false);
    }

    public static CanonicalIdentifier gtin(String canonicalNdc, String raw) {
        return new CanonicalIdentifier(IdentifierKind.GTIN, canonicalNdc, raw, false);
    }

    public static CanonicalIdentifier unknown(String raw) {
        return new CanonicalIdentifier(IdentifierKind.UNKNOWN, raw, raw, true);
    }

    public IdentifierKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public String getRaw() {
        return raw;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    /**
     * True when the identifier can take part in an equality comparison.
     */
    public boolean isRecognized() {
        return kind != IdentifierKind.UNKNOWN;
    }

    public boolean isBlank() {
        return raw == null || raw.trim().isEmpty();
    }

    /**
     * Two identifiers denote the same product when both were recognized and
     * their canonical NDC values agree, whatever shape they arrived in.
     */
    public boolean sameProductAs(CanonicalIdentifier other) {
        return other != null && isRecognized() && other.isRecognized() && value.equals(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CanonicalIdentifier)) {
            return false;
        }
        CanonicalIdentifier that = (CanonicalIdentifier) o;
        return lowConfidence == that.lowConfidence
                && kind == that.kind
                && Objects.equals(value, that.value)
                && Objects.equals(raw, that.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, raw, lowConfidence);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
