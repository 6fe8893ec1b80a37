package com.libragraph.nsm.api.model;

import com.libragraph.nsm.core.archive.SearchHit;
import com.libragraph.nsm.core.archive.SearchResult;

import java.util.List;

public record SearchView(String query, boolean fromIndex, List<Hit> hits) {

    public record Hit(String path, long matches, long size) {
    }

    public static SearchView of(SearchResult result) {
        List<Hit> hits = result.hits().stream()
                .map((SearchHit h) -> new Hit(h.path(), h.matches(), h.size()))
                .toList();
        return new SearchView(result.query(), result.fromIndex(), hits);
    }
}
