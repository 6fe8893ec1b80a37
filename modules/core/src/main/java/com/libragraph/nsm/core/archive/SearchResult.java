package com.libragraph.nsm.core.archive;

import java.util.List;

/**
 * Ranked hits of a search.
 *
 * @param fromIndex true when candidates came from the search index, false
 *                  when every frame was scanned
 */
public record SearchResult(String query, List<SearchHit> hits, boolean fromIndex) {

    public SearchResult {
        hits = List.copyOf(hits);
    }

    public List<String> paths() {
        return hits.stream().map(SearchHit::path).toList();
    }
}
