package com.libragraph.nsm.api.model;

import java.util.List;

/**
 * Body of the extract call. An empty or missing path list extracts every entry.
 */
public record ExtractRequest(String archive, List<String> paths, String destination) {
}
