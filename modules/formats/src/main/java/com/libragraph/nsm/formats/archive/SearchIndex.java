package com.libragraph.nsm.formats.archive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Inverted index from normalized token to the entries containing it, with a
 * per-entry occurrence count. Entries are referenced by their ordinal in the
 * archive index.
 *
 * <p>Entries whose words could not all be recorded (binary content, words
 * over the token length limit) are listed as unindexed; searches must scan
 * them.
 *
 * Tokens are byte strings held as ISO-8859-1 {@link String}s so that every
 * byte maps to exactly one char.
 */
public final class SearchIndex {

    public record Posting(int entryOrdinal, int occurrences) {
    }

    private final NavigableMap<String, List<Posting>> postings;
    private final SortedSet<Integer> unindexed;

    private SearchIndex(NavigableMap<String, List<Posting>> postings, SortedSet<Integer> unindexed) {
        this.postings = postings;
        this.unindexed = unindexed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Posting> postings(String token) {
        return postings.getOrDefault(token, List.of());
    }

    public boolean contains(String token) {
        return postings.containsKey(token);
    }

    public Set<String> tokens() {
        return Collections.unmodifiableSet(postings.keySet());
    }

    public int tokenCount() {
        return postings.size();
    }

    /**
     * Ordinals of entries whose content is not fully covered by the postings, ascending.
     */
    public SortedSet<Integer> unindexedEntries() {
        return Collections.unmodifiableSortedSet(unindexed);
    }

    public static final class Builder {
        private final TreeMap<String, List<Posting>> postings = new TreeMap<>();
        private final TreeSet<Integer> unindexed = new TreeSet<>();

        /**
         * Adds the token counts of one entry. Entries must be added in
         * ascending ordinal order.
         */
        public Builder add(int entryOrdinal, Map<String, Integer> tokenCounts) {
            tokenCounts.forEach((token, count) -> {
                if (count > 0) {
                    postings.computeIfAbsent(token, t -> new ArrayList<>())
                            .add(new Posting(entryOrdinal, count));
                }
            });
            return this;
        }

        public Builder markUnindexed(int entryOrdinal) {
            unindexed.add(entryOrdinal);
            return this;
        }

        public SearchIndex build() {
            TreeMap<String, List<Posting>> copy = new TreeMap<>();
            postings.forEach((token, list) -> copy.put(token, List.copyOf(list)));
            return new SearchIndex(copy, new TreeSet<>(unindexed));
        }
    }
}
