package com.companya.crm.model;

/**
 * Strength of an identity match.
 *
 * EXACT is not "stronger" than HIGH: it marks an observation that created a
 * new customer, so no match was needed.
 */
public enum MatchConfidence {
    HIGH,
    MEDIUM,
    LOW,
    EXACT
}
