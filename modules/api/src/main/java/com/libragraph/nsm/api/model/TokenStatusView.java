package com.libragraph.nsm.api.model;

import com.libragraph.nsm.core.ledger.TokenState;

import java.time.Instant;

/**
 * Ledger balance as reported over HTTP. The license id itself is never echoed.
 */
public record TokenStatusView(int availableTokens, boolean licensed, Instant lastSync) {

    public static TokenStatusView of(TokenState state) {
        return new TokenStatusView(
                state.availableTokens(),
                state.licenseId() != null && !state.licenseId().isBlank(),
                state.lastSync());
    }
}
