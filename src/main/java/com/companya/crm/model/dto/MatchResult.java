package com.companya.crm.model.dto;

import com.companya.crm.model.MatchConfidence;

/**
 * The identity decision taken for one contact record.
 */
public record MatchResult(
    String customerId,
    MatchConfidence confidence,
    String reason
) {
    public static final String NEW_CUSTOMER = "new_customer";

    public boolean isNewCustomer() {
        return confidence == MatchConfidence.EXACT;
    }
}
