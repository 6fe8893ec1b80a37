package com.libragraph.nsm.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.nsm.core.archive.ArchiveEngine;
import com.libragraph.nsm.core.ledger.FileLedgerStore;
import com.libragraph.nsm.core.ledger.LicenseAuthority;
import com.libragraph.nsm.core.ledger.UsageLedger;
import com.libragraph.nsm.formats.compress.CompressionEngine;
import com.libragraph.nsm.formats.registry.CodecRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Wires the archive engine, compression engine and usage ledger from
 * configuration.
 */
@ApplicationScoped
public class NsmProducer {

    private static final Logger log = Logger.getLogger(NsmProducer.class);

    @ConfigProperty(name = "nsm.compression.permits")
    Optional<Integer> permits;

    @ConfigProperty(name = "nsm.compression.zstd-level", defaultValue = "3")
    int zstdLevel;

    @ConfigProperty(name = "nsm.ledger.path", defaultValue = "~/.nsm/ledger.json")
    String ledgerPath;

    @ConfigProperty(name = "nsm.ledger.free-tokens", defaultValue = "1")
    int freeTokens;

    @ConfigProperty(name = "nsm.ledger.license-id")
    Optional<String> licenseId;

    @ConfigProperty(name = "nsm.search.max-results", defaultValue = "100")
    int maxResults;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    LicenseAuthority authority;

    @Produces
    @Singleton
    public CompressionEngine compressionEngine() {
        int permitCount = permits.orElse(CompressionEngine.defaultPermits());
        log.infof("Creating compression engine: permits=%d, zstdLevel=%d", permitCount, zstdLevel);
        return new CompressionEngine(CodecRegistry.defaults(zstdLevel), permitCount);
    }

    void closeCompressionEngine(@Disposes CompressionEngine engine) {
        log.info("Shutting down compression engine");
        engine.close();
    }

    @Produces
    @Singleton
    public UsageLedger usageLedger() {
        Path path = resolveLedgerPath(ledgerPath);
        log.infof("Usage ledger at %s (free allotment %d)", path, freeTokens);
        return new UsageLedger(new FileLedgerStore(path, objectMapper), authority, freeTokens, licenseId.orElse(null));
    }

    @Produces
    @Singleton
    public ArchiveEngine archiveEngine(CompressionEngine compression, UsageLedger ledger) {
        return new ArchiveEngine(compression, ledger, maxResults);
    }

    static Path resolveLedgerPath(String configured) {
        if (configured.equals("~") || configured.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), configured.substring(1)).normalize();
        }
        return Path.of(configured);
    }
}
