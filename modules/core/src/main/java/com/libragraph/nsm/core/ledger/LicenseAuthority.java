package com.libragraph.nsm.core.ledger;

/**
 * Remote marketplace that holds the authoritative token count for a license.
 * Implementations throw {@link LicenseValidationException} on any failure.
 */
public interface LicenseAuthority {

    LicenseStatus validate(String licenseId);

    PurchaseOrder purchase(String licenseId, int tokenCount);
}
