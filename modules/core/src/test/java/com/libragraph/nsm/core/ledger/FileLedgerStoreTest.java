package com.libragraph.nsm.core.ledger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileLedgerStoreTest {

    @TempDir
    Path dir;

    private FileLedgerStore store(Path path) {
        return new FileLedgerStore(path, FileLedgerStore.defaultMapper());
    }

    @Test
    void shouldBeEmptyBeforeFirstSave() {
        assertThat(store(dir.resolve("ledger.json")).load()).isEmpty();
    }

    @Test
    void shouldPersistStateAsJson() throws Exception {
        Path path = dir.resolve("nested/ledger.json");
        TokenState state = new TokenState("LIC-1", 7, Instant.parse("2024-05-01T10:00:00Z"));

        store(path).save(state);

        assertThat(store(path).load()).contains(state);
        String json = Files.readString(path, StandardCharsets.UTF_8);
        assertThat(json).contains("\"available_tokens\" : 7").contains("\"license_id\" : \"LIC-1\"")
                .contains("2024-05-01T10:00:00Z");
        try (var files = Files.list(path.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("ledger.json");
        }
    }

    @Test
    void shouldRestrictFileToOwner() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path path = dir.resolve("ledger.json");

        store(path).save(new TokenState(null, 1, null));

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(path))).isEqualTo("rw-------");
    }

    @Test
    void shouldReportCorruptState() throws Exception {
        Path path = dir.resolve("ledger.json");
        Files.writeString(path, "{ not json");

        assertThatThrownBy(() -> store(path).load())
                .isInstanceOf(LedgerPersistenceException.class)
                .hasMessageContaining(path.toString());
    }

    @Test
    void shouldReportNegativeBalanceAsCorrupt() throws Exception {
        Path path = dir.resolve("ledger.json");
        Files.writeString(path, "{\"available_tokens\": -3}");

        assertThatThrownBy(() -> store(path).load()).isInstanceOf(LedgerPersistenceException.class);
    }

    @Test
    void shouldFailToSaveWhenDirectoryIsAFile() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");

        assertThatThrownBy(() -> store(blocker.resolve("ledger.json")).save(new TokenState(null, 1, null)))
                .isInstanceOf(LedgerPersistenceException.class);
    }

    @Test
    void shouldAllowReentrantLocking() {
        FileLedgerStore store = store(dir.resolve("ledger.json"));

        String result = store.locked(() -> store.locked(() -> "inner"));

        assertThat(result).isEqualTo("inner");
        assertThat(dir.resolve("ledger.json.lock")).exists();
    }
}
