package com.libragraph.nsm.core.ledger;

/**
 * Thrown when archive creation is requested with a zero token balance.
 */
public class NoTokensAvailableException extends RuntimeException {

    public NoTokensAvailableException() {
        super("No tokens available. Purchase more tokens to create archives");
    }
}
