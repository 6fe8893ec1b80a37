package com.libragraph.nsm.core.archive;

import com.libragraph.nsm.formats.api.ArchiveError;

/**
 * A requested entry that was not extracted.
 */
public record EntryFailure(String path, ArchiveError error, String message) {
}
