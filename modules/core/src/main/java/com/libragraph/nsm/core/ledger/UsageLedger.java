package com.libragraph.nsm.core.ledger;

import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Token metering for archive creation.
 *
 * <p>One instance per process, shared by reference. Every operation runs
 * under an in-process lock and the store's exclusive lock, re-reading the
 * persisted state first; no balance is cached in memory. A change is
 * acknowledged only once it is persisted: if the save fails the caller gets a
 * {@link LedgerPersistenceException} and the old state stands.
 */
public class UsageLedger {

    private static final Logger log = Logger.getLogger(UsageLedger.class);

    public static final int DEFAULT_FREE_TOKENS = 1;

    private final LedgerStore store;
    private final LicenseAuthority authority;
    private final int freeAllotment;
    private final String licenseId;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public UsageLedger(LedgerStore store, LicenseAuthority authority, int freeAllotment, String licenseId) {
        this(store, authority, freeAllotment, licenseId, Clock.systemUTC());
    }

    public UsageLedger(LedgerStore store, LicenseAuthority authority, int freeAllotment, String licenseId,
                       Clock clock) {
        if (freeAllotment < 0) {
            throw new IllegalArgumentException("freeAllotment must be >= 0, got: " + freeAllotment);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.authority = authority;
        this.freeAllotment = freeAllotment;
        this.licenseId = licenseId == null || licenseId.isBlank() ? null : licenseId.trim();
        this.clock = clock;
    }

    /**
     * Atomically takes one token.
     *
     * @return tokens remaining after the debit
     * @throws NoTokensAvailableException if the balance is zero
     */
    public int consumeToken() {
        return guarded(() -> {
            TokenState current = current();
            if (current.availableTokens() <= 0) {
                log.warn("Token requested with zero balance");
                throw new NoTokensAvailableException();
            }
            TokenState next = current.withAvailableTokens(current.availableTokens() - 1);
            commit(next);
            log.infof("Token consumed, %d remaining", next.availableTokens());
            return next.availableTokens();
        });
    }

    public int availableTokens() {
        return guarded(() -> current().availableTokens());
    }

    public TokenState state() {
        return guarded(this::current);
    }

    /**
     * Replaces the local balance with the authoritative one from the remote
     * authority. Local state changes only after a successful round trip.
     */
    public TokenState validateOnline() {
        String license = requireLicense();
        if (authority == null) {
            throw new LicenseValidationException("No license authority configured");
        }
        LicenseStatus status = callAuthority(() -> authority.validate(license), "validate license");
        if (status == null || !status.valid()) {
            throw new LicenseValidationException("License was rejected by the marketplace");
        }
        if (status.availableTokens() < 0) {
            throw new LicenseValidationException("Marketplace reported a negative balance: " + status.availableTokens());
        }
        return guarded(() -> {
            Instant syncedAt = status.lastSync() != null ? status.lastSync() : clock.instant();
            TokenState next = current().synced(status.availableTokens(), syncedAt);
            commit(next);
            log.infof("License validated, %d tokens available", next.availableTokens());
            return next;
        });
    }

    /**
     * Starts a token purchase. Never changes local state; the new tokens
     * arrive through a later {@link #validateOnline()}.
     */
    public PurchaseOrder initiatePurchase(int tokenCount) {
        if (tokenCount <= 0) {
            throw new IllegalArgumentException("Token count must be positive, got: " + tokenCount);
        }
        String license = requireLicense();
        if (authority == null) {
            throw new LicenseValidationException("No license authority configured");
        }
        PurchaseOrder order = callAuthority(() -> authority.purchase(license, tokenCount), "initiate purchase");
        if (order == null || order.paymentUrl() == null || order.orderId() == null) {
            throw new LicenseValidationException("Marketplace returned an incomplete purchase order");
        }
        log.infof("Purchase of %d tokens initiated, order %s", tokenCount, order.orderId());
        return order;
    }

    private String requireLicense() {
        if (licenseId != null) {
            return licenseId;
        }
        String persisted = state().licenseId();
        if (persisted == null || persisted.isBlank()) {
            throw new LicenseValidationException("No license id configured");
        }
        return persisted;
    }

    private <T> T callAuthority(Supplier<T> call, String what) {
        try {
            return call.get();
        } catch (LicenseValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LicenseValidationException("Failed to " + what + ": " + e.getMessage(), e);
        }
    }

    private <T> T guarded(Supplier<T> action) {
        lock.lock();
        try {
            return store.locked(action);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-reads persisted state, seeding it on first run and adopting a newly
     * configured license id. Caller holds both locks.
     */
    private TokenState current() {
        TokenState loaded = store.load().orElse(null);
        if (loaded == null) {
            TokenState seeded = new TokenState(licenseId, freeAllotment, null);
            commit(seeded);
            log.infof("Ledger initialized with %d free tokens", freeAllotment);
            return seeded;
        }
        if (licenseId != null && !licenseId.equals(loaded.licenseId())) {
            TokenState relicensed = loaded.withLicenseId(licenseId);
            commit(relicensed);
            return relicensed;
        }
        return loaded;
    }

    private void commit(TokenState next) {
        store.save(next);
    }
}
