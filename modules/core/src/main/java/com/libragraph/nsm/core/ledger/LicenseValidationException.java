package com.libragraph.nsm.core.ledger;

/**
 * Remote license validation or purchase failed. Local ledger state is untouched.
 */
public class LicenseValidationException extends RuntimeException {

    public LicenseValidationException(String message) {
        super(message);
    }

    public LicenseValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
