package com.libragraph.nsm.formats.api;

import java.util.Objects;

/**
 * Unchecked failure of an archive operation. The {@link ArchiveError} tells
 * callers which class of problem occurred; the message carries the context
 * (archive path, entry, compress vs decompress).
 */
public class ArchiveException extends RuntimeException {

    private final ArchiveError error;

    public ArchiveException(ArchiveError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ArchiveException(ArchiveError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public ArchiveError error() {
        return error;
    }

    public boolean retryable() {
        return error.retryable();
    }

    /**
     * Re-wraps with additional context, keeping the error class.
     */
    public ArchiveException withContext(String context) {
        return new ArchiveException(error, context + ": " + getMessage(), this);
    }
}
