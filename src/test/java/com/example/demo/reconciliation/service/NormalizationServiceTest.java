package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CanonicalIdentifier;
import com.example.demo.reconciliation.model.IdentifierKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for identifier, date and amount normalization.
 */
class NormalizationServiceTest {

    private NormalizationService normalizationService;

    @BeforeEach
    void setUp() {
        normalizationService = new NormalizationService();
    }

    @Test
    void testNormalizeIdentifier_CanonicalNdcUnchanged() {
        // Act
        CanonicalIdentifier id = normalizationService.normalizeIdentifier("55150-0188-10");

        // Assert
        assertEquals(IdentifierKind.NDC, id.getKind());
        assertEquals("55150-0188-10", id.getValue());
        assertFalse(id.isLowConfidence());
    }

    @Test
    void testNormalizeIdentifier_HyphenatedShapesPadTo542() {
        assertEquals("00093-4155-01", normalizationService.normalizeIdentifier("0093-4155-01").getValue());
        assertEquals("12345-0678-90", normalizationService.normalizeIdentifier("12345-678-90").getValue());
        assertEquals("00093-4155-01", normalizationService.normalizeIdentifier(" 00093-4155-01 ").getValue());
    }

    @Test
    void testNormalizeIdentifier_DigitRuns() {
        // 10 digits are read as 5-3-2
        assertEquals("12345-0678-90", normalizationService.normalizeIdentifier("1234567890").getValue());
        assertEquals("00093-4155-01", normalizationService.normalizeIdentifier("00093415501").getValue());
    }

    @Test
    void testNormalizeIdentifier_GtinCarryingNdc() {
        // Act
        CanonicalIdentifier gtin14 = normalizationService.normalizeIdentifier("00312345678907");
        CanonicalIdentifier upc12 = normalizationService.normalizeIdentifier("312345678906");

        // Assert
        assertEquals(IdentifierKind.GTIN, gtin14.getKind());
        assertEquals("12345-0678-90", gtin14.getValue());
        assertEquals("00312345678907", gtin14.getRaw());
        assertEquals("12345-0678-90", upc12.getValue());
        assertTrue(gtin14.sameProductAs(normalizationService.normalizeIdentifier("12345-678-90")));
    }

    @Test
    void testNormalizeIdentifier_UnknownShapeKeepsRawValue() {
        // Act
        CanonicalIdentifier id = normalizationService.normalizeIdentifier("ABC-123");

        // Assert
        assertEquals(IdentifierKind.UNKNOWN, id.getKind());
        assertEquals("ABC-123", id.getValue());
        assertTrue(id.isLowConfidence());
        assertFalse(id.isRecognized());
    }

    @Test
    void testNormalizeIdentifier_BlankAndNull() {
        assertEquals(IdentifierKind.UNKNOWN, normalizationService.normalizeIdentifier(null).getKind());
        assertTrue(normalizationService.normalizeIdentifier("  ").isBlank());
        assertFalse(normalizationService.normalizeIdentifier(null)
                .sameProductAs(normalizationService.normalizeIdentifier(null)));
    }

    @Test
    void testNormalizeIdentifier_Idempotent() {
        List<String> inputs = Arrays.asList(
                "55150-0188-10", "0093-4155-01", "1234567890", "00093415501",
                "00312345678907", "312345678906", "ABC-123", "", null, "12-34");

        for (String input : inputs) {
            CanonicalIdentifier once = normalizationService.normalizeIdentifier(input);
            CanonicalIdentifier twice = normalizationService.normalizeIdentifier(once.getValue());
            assertEquals(once.getValue(), twice.getValue(), "value changed for " + input);
        }
    }

    @Test
    void testNormalizeDate_SupportedFormats() {
        assertEquals(LocalDate.of(2025, 4, 30), normalizationService.normalizeDate("2025-04-30"));
        assertEquals(LocalDate.of(2025, 4, 30), normalizationService.normalizeDate("04/30/2025"));
        assertEquals(LocalDate.of(2025, 4, 3), normalizationService.normalizeDate("4/3/2025"));
        assertEquals(LocalDate.of(2028, 2, 29), normalizationService.normalizeDate("29-FEB-28"));
        assertEquals(LocalDate.of(2025, 5, 31), normalizationService.normalizeDate("31-May-2025"));
    }

    @Test
    void testNormalizeDate_InvalidReturnsNull() {
        assertNull(normalizationService.normalizeDate("2025-02-30"));
        assertNull(normalizationService.normalizeDate("31-FEB-25"));
        assertNull(normalizationService.normalizeDate("31-Apr-2025"));
        assertNull(normalizationService.normalizeDate("not a date"));
        assertNull(normalizationService.normalizeDate(""));
        assertNull(normalizationService.normalizeDate(null));
    }

    @Test
    void testParseAmount() {
        assertEquals(0, new BigDecimal("1141.92").compareTo(normalizationService.parseAmount("$1,141.92")));
        assertEquals(0, new BigDecimal("23.79").compareTo(normalizationService.parseAmount("23.790")));
        assertNull(normalizationService.parseAmount("N/A"));
        assertNull(normalizationService.parseAmount(null));
    }

    @Test
    void testNormalizeLot() {
        assertEquals("AB12", normalizationService.normalizeLot(" ab 12 "));
        assertNull(normalizationService.normalizeLot("   "));
        assertNull(normalizationService.normalizeLot(null));
    }
}
