package com.companya.crm.service.flags.rules;

import java.util.List;
import java.util.Locale;

/**
 * Keyword classification of membership names.
 */
public final class MembershipNames {

    static final List<String> PREPAID_PASS_KEYWORDS = List.of("2-week", "2 week", "two week");
    static final List<String> YOUTH_KEYWORDS = List.of("youth", "family", "junior", "kid", "child");

    private MembershipNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Prepaid passes expire on their own and are not counted as memberships.
     */
    public static boolean isPrepaidPass(String membershipName) {
        return containsAny(membershipName, PREPAID_PASS_KEYWORDS);
    }

    public static boolean isYouth(String membershipName) {
        return containsAny(membershipName, YOUTH_KEYWORDS);
    }

    private static boolean containsAny(String name, List<String> keywords) {
        if (name == null || name.isBlank()) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
