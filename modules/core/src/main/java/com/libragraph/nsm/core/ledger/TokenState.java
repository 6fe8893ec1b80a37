package com.libragraph.nsm.core.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted ledger state. The JSON file holding it is the only source of truth.
 *
 * @param licenseId       license used for remote validation, may be null
 * @param availableTokens tokens left for archive creation
 * @param lastSync        time of the last successful remote validation, null if never
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenState(
        @JsonProperty("license_id") String licenseId,
        @JsonProperty("available_tokens") int availableTokens,
        @JsonProperty("last_sync") Instant lastSync
) {
    public TokenState {
        if (availableTokens < 0) {
            throw new IllegalArgumentException("availableTokens must be >= 0, got: " + availableTokens);
        }
    }

    public TokenState withAvailableTokens(int tokens) {
        return new TokenState(licenseId, tokens, lastSync);
    }

    public TokenState withLicenseId(String id) {
        return new TokenState(id, availableTokens, lastSync);
    }

    public TokenState synced(int tokens, Instant at) {
        return new TokenState(licenseId, tokens, at);
    }
}
