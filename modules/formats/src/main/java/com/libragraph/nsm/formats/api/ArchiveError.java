package com.libragraph.nsm.formats.api;

/**
 * Failure classes raised by the format codec, the compression engine and the
 * archive engine. Carried by {@link ArchiveException}.
 */
public enum ArchiveError {
    /** Bad magic, truncated header or structurally broken index. */
    INVALID_FORMAT(false),
    /** Header version newer than this codec understands. */
    UNSUPPORTED_VERSION(false),
    /** Unknown compression or encryption tag, or no codec registered for it. */
    UNSUPPORTED_ALGORITHM(false),
    /** Data block, frame content or authentication tag does not match. */
    CHECKSUM_MISMATCH(false),
    ARCHIVE_READ_FAILURE(true),
    ARCHIVE_WRITE_FAILURE(true),
    /** Archive is encrypted and no key was supplied. */
    ENCRYPTION_KEY_REQUIRED(false),
    /** Requested path is not in the index (reported per entry). */
    ENTRY_NOT_FOUND(false),
    /** Entry path would resolve outside the extraction directory (reported per entry). */
    UNSAFE_PATH(false);

    private final boolean retryable;

    ArchiveError(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether retrying the same call may succeed. Data problems never do.
     */
    public boolean retryable() {
        return retryable;
    }
}
