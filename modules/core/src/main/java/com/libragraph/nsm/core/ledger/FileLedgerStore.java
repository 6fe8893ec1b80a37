package com.libragraph.nsm.core.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * JSON file ledger store.
 *
 * <p>Writes go to a temp file in the same directory, are forced to disk and
 * then atomically renamed over the ledger file. The file is readable by its
 * owner only where the filesystem supports POSIX permissions.
 *
 * <p>{@link #locked} takes an exclusive {@link FileLock} on
 * {@code <ledger>.lock}. Since a JVM cannot hold two overlapping file locks,
 * threads of one process first serialize on a per-path in-process lock.
 */
public class FileLedgerStore implements LedgerStore {

    private static final Logger log = Logger.getLogger(FileLedgerStore.class);

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final ConcurrentMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path path;
    private final Path lockPath;
    private final ObjectMapper mapper;

    public FileLedgerStore(Path path, ObjectMapper mapper) {
        this.path = path.toAbsolutePath().normalize();
        this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
        this.mapper = mapper;
    }

    /**
     * Mapper with ISO-8601 timestamps, for use outside a container that
     * already provides one.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path path() {
        return path;
    }

    @Override
    public Optional<TokenState> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), TokenState.class));
        } catch (IOException | IllegalArgumentException e) {
            throw new LedgerPersistenceException("Failed to read ledger state: " + path, e);
        }
    }

    @Override
    public void save(TokenState state) {
        Path temp = null;
        try {
            Files.createDirectories(path.getParent());
            temp = Files.createTempFile(path.getParent(), "." + path.getFileName(), ".tmp");
            restrictToOwner(temp);
            byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
            try (FileChannel out = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(json);
                while (buf.hasRemaining()) {
                    out.write(buf);
                }
                out.force(true);
            }
            moveIntoPlace(temp);
            temp = null;
            log.debugf("Ledger saved: %d tokens", state.availableTokens());
        } catch (IOException e) {
            throw new LedgerPersistenceException("Failed to write ledger state: " + path, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public <T> T locked(Supplier<T> action) {
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(lockPath, p -> new ReentrantLock());
        processLock.lock();
        try {
            if (processLock.getHoldCount() > 1) {
                return action.get();
            }
            Files.createDirectories(lockPath.getParent());
            try (FileChannel channel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            throw new LedgerPersistenceException("Failed to lock ledger: " + lockPath, e);
        } finally {
            processLock.unlock();
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warnf("Atomic move not supported for %s, replacing non-atomically", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (file.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, OWNER_ONLY);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warnf(e, "Failed to delete temp ledger file %s", file);
        }
    }
}
