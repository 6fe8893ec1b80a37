package com.libragraph.nsm.core.search;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Byte-level tokenizer shared by index building and query analysis.
 *
 * <p>A token is a maximal run of ASCII letters and digits or of bytes
 * {@code >= 0x80} (so UTF-8 encoded non-ASCII letters stay inside words),
 * with ASCII letters lowercased. Runs shorter than {@link #MIN_TOKEN_LENGTH}
 * or longer than {@link #MAX_TOKEN_LENGTH} bytes are not tokens.
 *
 * <p>Tokens are returned as ISO-8859-1 strings: one char per byte.
 */
public final class Tokenizer {

    public static final int MIN_TOKEN_LENGTH = 2;
    public static final int MAX_TOKEN_LENGTH = 64;

    private Tokenizer() {
    }

    static boolean isTokenByte(int b) {
        return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9') || b >= 0x80;
    }

    static int lower(int b) {
        return (b >= 'A' && b <= 'Z') ? b + ('a' - 'A') : b;
    }

    /**
     * Analyzes a search query with the same rules the index was built with.
     */
    public static Query analyze(String query) {
        byte[] bytes = query.getBytes(StandardCharsets.UTF_8);
        byte[] normalized = new byte[bytes.length];
        LinkedHashSet<String> tokens = new LinkedHashSet<>();
        LinkedHashSet<Term> terms = new LinkedHashSet<>();
        boolean oversized = false;
        int runStart = -1;
        for (int i = 0; i <= bytes.length; i++) {
            int b = i < bytes.length ? bytes[i] & 0xFF : -1;
            if (i < bytes.length) {
                normalized[i] = (byte) lower(b);
            }
            if (b != -1 && isTokenByte(b)) {
                if (runStart < 0) runStart = i;
                continue;
            }
            if (runStart >= 0) {
                int len = i - runStart;
                if (len > MAX_TOKEN_LENGTH) {
                    oversized = true;
                } else if (len >= MIN_TOKEN_LENGTH) {
                    String token = new String(normalized, runStart, len, StandardCharsets.ISO_8859_1);
                    tokens.add(token);
                    terms.add(new Term(token, runStart == 0, i == bytes.length));
                }
                runStart = -1;
            }
        }
        String normalizedQuery = new String(normalized, StandardCharsets.ISO_8859_1);
        return new Query(query, List.copyOf(tokens), List.copyOf(terms), normalizedQuery, oversized);
    }

    /**
     * A word of the query and whether it touches the start or end of the
     * query. A word that touches an edge may be part of a longer word in the
     * content; one bounded on both sides must appear there as a whole token.
     */
    public record Term(String token, boolean openStart, boolean openEnd) {

        /**
         * Whether an indexed content token can hold this word at a position
         * consistent with a verbatim match of the whole query.
         */
        public boolean matches(String indexed) {
            if (openStart && openEnd) return indexed.contains(token);
            if (openStart) return indexed.endsWith(token);
            if (openEnd) return indexed.startsWith(token);
            return indexed.equals(token);
        }
    }

    /**
     * An analyzed query.
     *
     * @param tokens     distinct tokens in order of first appearance
     * @param terms      distinct tokens with their position relative to the query edges
     * @param normalized the query bytes with ASCII lowercased, as ISO-8859-1
     * @param oversized  whether some word was too long to be indexed
     */
    public record Query(String text, List<String> tokens, List<Term> terms, String normalized,
                        boolean oversized) {

        /**
         * Whether the search index can narrow the entries that may contain this query.
         */
        public boolean indexable() {
            return !tokens.isEmpty() && !oversized;
        }

        /**
         * Whether the query is exactly one token, with nothing around it. Its
         * occurrences can then be counted from the index postings alone.
         */
        public boolean singleToken() {
            return tokens.size() == 1 && tokens.get(0).equals(normalized);
        }
    }
}
