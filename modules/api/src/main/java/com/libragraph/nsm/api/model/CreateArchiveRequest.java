package com.libragraph.nsm.api.model;

import java.util.List;

/**
 * Body of {@code POST /api/v1/archives}. Omitted options fall back to the
 * configured defaults.
 */
public record CreateArchiveRequest(
        String output,
        List<String> inputs,
        String compression,
        Boolean searchIndex,
        Boolean encrypt
) {
}
