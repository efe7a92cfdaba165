package com.companya.crm.service.identity;

/**
 * Raised when the resolved registry cannot be written. The transaction is rolled back,
 * leaving the previously persisted registry untouched.
 */
public class IdentityResolutionException extends RuntimeException {

    public IdentityResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
