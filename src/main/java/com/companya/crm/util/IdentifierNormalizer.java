package com.companya.crm.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison forms for raw emails, phones and names.
 * Every method is total: malformed input yields null, never an exception.
 */
public final class IdentifierNormalizer {

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern NON_LETTER_OR_SPACE = Pattern.compile("[^a-z\\s]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private IdentifierNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Lower-cases and trims an email address.
     *
     * @param email raw address, possibly null or malformed
     * @return normalized address, or null if there is no '@' or the domain has no '.'
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String normalized = email.toLowerCase(Locale.ROOT).trim();
        int at = normalized.lastIndexOf('@');
        if (at < 0 || normalized.indexOf('.', at + 1) < 0) {
            return null;
        }
        return normalized;
    }

    /**
     * Normalizes a phone number to E.164, assuming North America when the country code is missing.
     *
     * <pre>
     * "555-123-4567"    -> "+15551234567"
     * "1 555 123 4567"  -> "+15551234567"
     * "+44 20 7946 0958" -> "+442079460958"
     * </pre>
     */
    public static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        if (digits.isEmpty()) {
            return null;
        }
        if (digits.length() == 10) {
            return "+1" + digits;
        }
        return "+" + digits;
    }

    public static String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.toLowerCase(Locale.ROOT).trim();
        normalized = NON_LETTER_OR_SPACE.matcher(normalized).replaceAll("");
        normalized = WHITESPACE_RUN.matcher(normalized).replaceAll(" ").trim();
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * @return the lower-cased part after the last '@', or null when there is none
     */
    public static String extractDomain(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf('@');
        if (at < 0) {
            return null;
        }
        return email.substring(at + 1).toLowerCase(Locale.ROOT);
    }
}
