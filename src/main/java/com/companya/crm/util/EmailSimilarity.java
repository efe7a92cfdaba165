package com.companya.crm.util;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.Locale;
import java.util.Map;

/**
 * Edit-distance similarity and TLD typo tolerance for the fuzzy identity tier.
 */
public final class EmailSimilarity {

    /**
     * Absorbs floating-point noise so that a score of exactly 0.90 passes a 0.90 threshold.
     */
    private static final double EPSILON = 1e-9;

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    /**
     * Common misspellings of a top-level domain, keyed by the misspelled TLD.
     */
    public static final Map<String, String> DOMAIN_TYPO_CORRECTIONS = Map.ofEntries(
            // .com
            Map.entry("con", "com"),
            Map.entry("cmo", "com"),
            Map.entry("ocm", "com"),
            Map.entry("om", "com"),
            Map.entry("comm", "com"),
            Map.entry("xom", "com"),
            Map.entry("vom", "com"),
            Map.entry("coм", "com"), // Cyrillic em
            // .org
            Map.entry("og", "org"),
            Map.entry("ogr", "org"),
            Map.entry("rog", "org"),
            // .net
            Map.entry("ner", "net"),
            Map.entry("nte", "net"),
            Map.entry("met", "net"),
            // .edu
            Map.entry("eud", "edu"),
            Map.entry("deu", "edu")
    );

    private EmailSimilarity() {
        // Utility class - prevent instantiation
    }

    /**
     * @return 1 - levenshtein(a, b) / max(len(a), len(b)), or 0 when either side is empty
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - ((double) levenshteinDistance(a, b) / maxLength);
    }

    public static boolean meetsThreshold(double similarity, double threshold) {
        return similarity + EPSILON >= threshold;
    }

    /**
     * Similarity as a whole percentage, truncated: 0.9 -> 90, 0.957 -> 95.
     */
    public static int toPercent(double similarity) {
        return (int) (similarity * 100 + EPSILON);
    }

    public static int levenshteinDistance(String a, String b) {
        return LEVENSHTEIN.apply(a, b);
    }

    /**
     * Replaces a misspelled TLD (the part after the last '.') with its correction.
     * Accepts a bare domain or a full address: "gmail.con" -> "gmail.com".
     */
    public static String fixDomainTypo(String domain) {
        if (domain == null || domain.isEmpty()) {
            return domain;
        }
        String lower = domain.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0) {
            return lower;
        }
        String correctedTld = DOMAIN_TYPO_CORRECTIONS.get(lower.substring(dot + 1));
        return correctedTld != null ? lower.substring(0, dot + 1) + correctedTld : lower;
    }

    public static boolean domainsMatch(String domain1, String domain2) {
        if (domain1 == null || domain2 == null || domain1.isEmpty() || domain2.isEmpty()) {
            return false;
        }
        return fixDomainTypo(domain1).equals(fixDomainTypo(domain2));
    }
}
