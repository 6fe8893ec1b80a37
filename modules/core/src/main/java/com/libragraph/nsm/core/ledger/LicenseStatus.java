package com.libragraph.nsm.core.ledger;

import java.time.Instant;

/**
 * Answer of the remote authority for one license.
 */
public record LicenseStatus(boolean valid, int availableTokens, Instant lastSync) {
}
