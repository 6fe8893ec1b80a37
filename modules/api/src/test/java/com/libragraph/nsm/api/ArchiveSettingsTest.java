package com.libragraph.nsm.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class ArchiveSettingsTest {

    @TempDir
    Path root;

    @Test
    void shouldResolveRelativePathsUnderRoot() {
        assertThat(ArchiveSettings.confine(root, "docs/a.nsm", "archive")).isEqualTo(root.resolve("docs/a.nsm"));
        assertThat(ArchiveSettings.confine(root, root.resolve("b.nsm").toString(), "archive"))
                .isEqualTo(root.resolve("b.nsm"));
    }

    @Test
    void shouldRejectPathsOutsideRoot() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ArchiveSettings.confine(root, "../escape.nsm", "output"))
                .withMessageContaining("output is outside the permitted root");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ArchiveSettings.confine(root, "/etc/passwd", "inputs"));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ArchiveSettings.confine(root, "docs/../../escape", "archive"));
    }

    @Test
    void shouldAcceptAnyPathWithoutRoot() {
        assertThat(ArchiveSettings.confine(null, "/etc/passwd", "archive")).isEqualTo(Path.of("/etc/passwd"));
    }

    @Test
    void shouldRequireValue() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ArchiveSettings.confine(root, " ", "destination"))
                .withMessage("destination is required");
    }
}
