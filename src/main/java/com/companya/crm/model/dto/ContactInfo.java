package com.companya.crm.model.dto;

/**
 * Reachable contact details for a customer, possibly borrowed from a parent.
 */
public record ContactInfo(
    String email,
    String phone,
    boolean usingParentContact
) {
    public static final ContactInfo NONE = new ContactInfo(null, null, false);

    public boolean hasAny() {
        return hasText(email) || hasText(phone);
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
