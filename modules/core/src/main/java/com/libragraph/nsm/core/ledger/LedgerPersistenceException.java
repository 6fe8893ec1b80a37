package com.libragraph.nsm.core.ledger;

/**
 * Ledger state could not be read or durably written. The caller should
 * check the disk; in-memory state was left unchanged.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
