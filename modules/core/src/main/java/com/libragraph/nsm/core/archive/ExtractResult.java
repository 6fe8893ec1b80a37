package com.libragraph.nsm.core.archive;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of an extract. Missing or unsafe entries are listed in
 * {@code failures}; everything else was written.
 */
public record ExtractResult(Path destination, List<String> extracted, List<EntryFailure> failures, long bytesWritten) {

    public ExtractResult {
        extracted = List.copyOf(extracted);
        failures = List.copyOf(failures);
    }

    public boolean complete() {
        return failures.isEmpty();
    }
}
