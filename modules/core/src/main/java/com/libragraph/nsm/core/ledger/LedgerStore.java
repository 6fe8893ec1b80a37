package com.libragraph.nsm.core.ledger;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable home of the {@link TokenState}.
 */
public interface LedgerStore {

    /**
     * Reads the persisted state; empty on first run.
     *
     * @throws LedgerPersistenceException if the state exists but cannot be read
     */
    Optional<TokenState> load();

    /**
     * Durably replaces the persisted state. Either the new state is fully
     * persisted or the old one is left in place.
     *
     * @throws LedgerPersistenceException on any write failure
     */
    void save(TokenState state);

    /**
     * Runs {@code action} while holding the store's exclusive lock, so a
     * load-modify-save sequence is atomic with respect to other processes.
     */
    <T> T locked(Supplier<T> action);
}
