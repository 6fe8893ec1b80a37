package com.libragraph.nsm.api;

import com.libragraph.nsm.formats.crypto.FrameCipher;
import com.libragraph.nsm.types.CompressionType;
import jakarta.annotation.PostConstruct;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Request defaults for the archive endpoints: compression algorithm, the
 * server-side encryption key and the directory request paths are confined to.
 *
 * <p>Starts at boot so a missing API key or root is reported before the first request.
 */
@Startup
@ApplicationScoped
public class ArchiveSettings {

    private static final Logger log = Logger.getLogger(ArchiveSettings.class);

    @ConfigProperty(name = "nsm.compression.default", defaultValue = "zstd")
    String defaultCompression;

    @ConfigProperty(name = "nsm.archive.encryption-key")
    Optional<String> encryptionKey;

    @ConfigProperty(name = "nsm.api.root")
    Optional<String> apiRoot;

    @ConfigProperty(name = "nsm.api.key")
    Optional<String> apiKey;

    private CompressionType compression;
    private FrameCipher cipher;
    private Path root;

    @PostConstruct
    void init() {
        compression = CompressionType.fromLabel(defaultCompression);
        cipher = encryptionKey.filter(k -> !k.isBlank()).map(FrameCipher::fromBase64).orElse(null);
        log.infof("Archive defaults: compression=%s, encryption key %s",
                compression.label(), cipher != null ? "configured" : "not configured");
        root = apiRoot.filter(r -> !r.isBlank()).map(r -> Path.of(r).toAbsolutePath().normalize()).orElse(null);
        if (root != null) {
            log.infof("Request paths confined to %s", root);
        } else {
            log.warn("nsm.api.root is not set: requests may read and write any path the server can reach");
        }
        if (apiKey.filter(k -> !k.isBlank()).isEmpty()) {
            log.warn("nsm.api.key is not set: /api/v1 accepts unauthenticated requests");
        }
    }

    /**
     * Filesystem path for a request field, checked against the configured root.
     */
    public Path resolve(String value, String field) {
        return confine(root, value, field);
    }

    /**
     * Relative values resolve against {@code root}; absolute ones must already
     * lie inside it. A null root accepts any path.
     */
    static Path confine(Path root, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        Path path = Path.of(value);
        if (root == null) {
            return path;
        }
        Path resolved = root.resolve(path).toAbsolutePath().normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException(field + " is outside the permitted root: " + value);
        }
        return resolved;
    }

    public CompressionType defaultCompression() {
        return compression;
    }

    public CompressionType compression(String requested) {
        if (requested == null || requested.isBlank()) {
            return compression;
        }
        return CompressionType.fromLabel(requested);
    }

    /**
     * Cipher for reading archives; null when no key is configured.
     */
    public FrameCipher cipher() {
        return cipher;
    }

    public FrameCipher requireCipher() {
        if (cipher == null) {
            throw new IllegalArgumentException("Encryption requested but nsm.archive.encryption-key is not set");
        }
        return cipher;
    }
}
