package com.libragraph.nsm.formats.archive;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered list of entries, in the order their frames appear in the data
 * block, plus the optional search index.
 */
public final class ArchiveIndex {

    private final List<IndexEntry> entries;
    private final Map<String, Integer> ordinals;
    private final SearchIndex searchIndex;

    public ArchiveIndex(List<IndexEntry> entries, SearchIndex searchIndex) {
        this.entries = List.copyOf(entries);
        this.searchIndex = searchIndex;
        this.ordinals = new HashMap<>();
        for (int i = 0; i < this.entries.size(); i++) {
            if (ordinals.put(this.entries.get(i).path(), i) != null) {
                throw new IllegalArgumentException("Duplicate entry path: " + this.entries.get(i).path());
            }
        }
    }

    public List<IndexEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public IndexEntry get(int ordinal) {
        return entries.get(ordinal);
    }

    public Optional<IndexEntry> find(String path) {
        Integer ordinal = ordinals.get(path);
        return ordinal == null ? Optional.empty() : Optional.of(entries.get(ordinal));
    }

    public Optional<SearchIndex> searchIndex() {
        return Optional.ofNullable(searchIndex);
    }

    public long totalUncompressed() {
        return entries.stream().mapToLong(IndexEntry::uncompressedSize).sum();
    }

    /**
     * Length of the data block implied by the entries.
     */
    public long dataBlockLength() {
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).frameEnd();
    }
}
