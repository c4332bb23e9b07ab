package com.example.demo.reconciliation.service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case- and punctuation-insensitive text similarity used for vendor names and
 * product descriptions.
 */
public final class TextSimilarity {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

    private TextSimilarity() {
    }

    /**
     * Lower-cases, drops punctuation and collapses whitespace.
     */
    public static String canonicalText(String text) {
        if (text == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Similarity in [0, 1]. Containment of one canonical text in the other
     * scores 1.0; otherwise normalized edit distance. Blank input on either
     * side scores 0.
     */
    public static double similarity(String a, String b) {
        String left = canonicalText(a);
        String right = canonicalText(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.contains(right) || right.contains(left)) {
            return 1.0;
        }
        int distance = levenshteinDistance(left, right);
        int maxLength = Math.max(left.length(), right.length());
        return 1.0 - ((double) distance / maxLength);
    }

    /**
     * Alphanumeric, case-insensitive equality; false when either side is blank.
     */
    public static boolean sameReference(String a, String b) {
        String left = canonicalText(a).replace(" ", "");
        String right = canonicalText(b).replace(" ", "");
        return !left.isEmpty() && left.equals(right);
    }

    static int levenshteinDistance(String s1, String s2) {
        int m = s1.length();
        int n = s2.length();

        if (m == 0) return n;
        if (n == 0) return m;
        if (s1.equals(s2)) return 0;

        // two rows instead of the full matrix
        int[] prevRow = new int[n + 1];
        int[] currRow = new int[n + 1];

        for (int j = 0; j <= n; j++) {
            prevRow[j] = j;
        }

        for (int i = 1; i <= m; i++) {
            currRow[0] = i;

            for (int j = 1; j <= n; j++) {
                int cost = (s1.charAt(i - 1) == s2.charAt(j - 1)) ? 0 : 1;
                currRow[j] = Math.min(
                        currRow[j - 1] + 1,
                        Math.min(prevRow[j] + 1, prevRow[j - 1] + cost));
            }

            int[] swap = prevRow;
            prevRow = currRow;
            currRow = swap;
        }

        return prevRow[n];
    }
}
