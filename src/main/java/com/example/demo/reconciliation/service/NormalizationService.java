package com.example.demo.reconciliation.service;

import com.example.demo.reconciliation.model.CanonicalIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes identifiers, dates and amounts so later comparisons do not
 * depend on the format a document happened to use.
 * <p>
 * All methods are pure and never throw: input that cannot be understood comes
 * back as {@code null} or as a low-confidence identifier.
 * <p>
 * GTIN to NDC conversion is positional. Check digits are not validated and
 * labeler-code length is inferred, not looked up, so a 10-digit NDC without
 * hyphens is assumed to be laid out 5-3-2. This is an approximation that may
 * mis-segment 4-4-2 or 5-4-1 codes that arrive without hyphens.
 */
@Service
public class NormalizationService {

    private static final Logger logger = LoggerFactory.getLogger(NormalizationService.class);

    private static final Pattern HYPHENATED_NDC = Pattern.compile("^(\\d{4,5})-(\\d{3,4})-(\\d{1,2})$");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern AMOUNT = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    /** GS1 company prefix under which US NDCs are encoded in a GTIN. */
    private static final String NDC_GS1_PREFIX = "03";

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("d-MMM-")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
                    .toFormatter(Locale.US)
                    .withResolverStyle(ResolverStyle.STRICT),
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("d-MMM-uuuu")
                    .toFormatter(Locale.US)
                    .withResolverStyle(ResolverStyle.STRICT));

    /**
     * Normalizes an NDC or GTIN to its canonical hyphenated 5-4-2 NDC.
     *
     * @param raw identifier as extracted, may be null
     * @return canonical identifier; kind {@code UNKNOWN} with the raw value
     *         unchanged when no known shape matches
     */
    public CanonicalIdentifier normalizeIdentifier(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return CanonicalIdentifier.unknown(raw);
        }

        String trimmed = raw.trim();

        Matcher hyphenated = HYPHENATED_NDC.matcher(trimmed);
        if (hyphenated.matches()) {
            String ndc = segmentHyphenated(hyphenated.group(1), hyphenated.group(2), hyphenated.group(3));
            return ndc != null ? CanonicalIdentifier.ndc(ndc, raw) : CanonicalIdentifier.unknown(raw);
        }

        String compact = NON_ALPHANUMERIC.matcher(trimmed).replaceAll("");
        if (!DIGITS.matcher(compact).matches()) {
            return CanonicalIdentifier.unknown(raw);
        }

        switch (compact.length()) {
            case 10:
                return CanonicalIdentifier.ndc(fromTenDigits(compact), raw);
            case 11:
                return CanonicalIdentifier.ndc(fromElevenDigits(compact), raw);
            case 12:
            case 13:
            case 14: {
                String ndc = fromGtin(leftPad(compact, 14));
                return ndc != null ? CanonicalIdentifier.gtin(ndc, raw) : CanonicalIdentifier.unknown(raw);
            }
            default:
                return CanonicalIdentifier.unknown(raw);
        }
    }

    /**
     * Parses ISO ({@code 2025-04-30}), US slash ({@code 04/30/2025}) and compact
     * alphabetic ({@code 29-FEB-28}, {@code 31-May-2025}) dates.
     *
     * @return the date, or null when no format applies
     */
    public LocalDate normalizeDate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String trimmed = raw.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                logger.trace("'{}' does not match {}", trimmed, format);
            }
        }
        logger.debug("Unparseable date '{}'", raw);
        return null;
    }

    /**
     * Parses an amount such as {@code $1,141.92} or {@code 23.790}.
     *
     * @return the amount, or null when the text is not a number
     */
    public BigDecimal parseAmount(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.trim()
                .replace("$", "")
                .replace(",", "")
                .replace(" ", "");
        if (cleaned.isEmpty() || !AMOUNT.matcher(cleaned).matches()) {
            return null;
        }
        return new BigDecimal(cleaned);
    }

    /**
     * Case- and whitespace-insensitive form of a lot number, null when blank.
     */
    public String normalizeLot(String lot) {
        if (lot == null) {
            return null;
        }
        String cleaned = lot.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        return cleaned.isEmpty() ? null : cleaned;
    }

    private String segmentHyphenated(String labeler, String product, String pkg) {
        // 5-4-2, 5-3-2 and 4-4-2 pad to 5-4-2; other combinations are not NDCs
        boolean recognized = (labeler.length() == 5 && product.length() == 4 && pkg.length() == 2)
                || (labeler.length() == 5 && product.length() == 3 && pkg.length() == 2)
                || (labeler.length() == 4 && product.length() == 4 && pkg.length() == 2);
        if (!recognized) {
            return null;
        }
        return format542(leftPad(labeler, 5), leftPad(product, 4), leftPad(pkg, 2));
    }

    private String fromTenDigits(String digits) {
        return format542(digits.substring(0, 5), "0" + digits.substring(5, 8), digits.substring(8, 10));
    }

    private String fromElevenDigits(String digits) {
        return format542(digits.substring(0, 5), digits.substring(5, 9), digits.substring(9, 11));
    }

    private String fromGtin(String gtin14) {
        // indicator digit + 12 payload digits + check digit
        String payload = gtin14.substring(1, 13);
        if (payload.startsWith(NDC_GS1_PREFIX)) {
            return fromTenDigits(payload.substring(2));
        }
        if (payload.charAt(0) == '0') {
            return fromElevenDigits(payload.substring(1));
        }
        return null;
    }

    private static String format542(String labeler, String product, String pkg) {
        return labeler + "-" + product + "-" + pkg;
    }

    private static String leftPad(String value, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = value.length(); i < length; i++) {
            sb.append('0');
        }
        return sb.append(value).toString();
    }
}
