package com.libragraph.nsm.api.model;

/**
 * Error body shared by every endpoint.
 *
 * @param error   stable machine-readable code, e.g. {@code CHECKSUM_MISMATCH}
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String message) {
}
