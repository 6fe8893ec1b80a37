package com.libragraph.nsm.core.search;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Counts non-overlapping, ASCII case-insensitive occurrences of a byte
 * pattern in everything written to it (Knuth-Morris-Pratt).
 */
public class OccurrenceCounter extends OutputStream {

    private final byte[] pattern;
    private final int[] failure;
    private int matched;
    private long count;

    public OccurrenceCounter(String needle) {
        byte[] raw = needle.getBytes(StandardCharsets.UTF_8);
        if (raw.length == 0) {
            throw new IllegalArgumentException("Search pattern must not be empty");
        }
        pattern = new byte[raw.length];
        for (int i = 0; i < raw.length; i++) {
            pattern[i] = (byte) Tokenizer.lower(raw[i] & 0xFF);
        }
        failure = new int[pattern.length];
        for (int i = 1, k = 0; i < pattern.length; i++) {
            while (k > 0 && pattern[i] != pattern[k]) k = failure[k - 1];
            if (pattern[i] == pattern[k]) k++;
            failure[i] = k;
        }
    }

    @Override
    public void write(int b) {
        byte c = (byte) Tokenizer.lower(b & 0xFF);
        while (matched > 0 && c != pattern[matched]) matched = failure[matched - 1];
        if (c == pattern[matched]) matched++;
        if (matched == pattern.length) {
            count++;
            matched = 0;
        }
    }

    @Override
    public void write(byte[] b, int off, int len) {
        for (int i = off; i < off + len; i++) {
            write(b[i]);
        }
    }

    public long count() {
        return count;
    }
}
