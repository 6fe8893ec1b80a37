package com.libragraph.nsm.core.search;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Sink that tokenizes everything written to it and counts occurrences per
 * token. Content containing a NUL byte is treated as binary and yields no
 * tokens. Words longer than {@link Tokenizer#MAX_TOKEN_LENGTH} are dropped,
 * which leaves the counts incomplete.
 */
public class TokenCollector extends OutputStream {

    private final Map<String, Integer> counts = new HashMap<>();
    private final byte[] run = new byte[Tokenizer.MAX_TOKEN_LENGTH];
    private int runLength;
    private boolean binary;
    private boolean oversized;
    private boolean finished;

    @Override
    public void write(int b) {
        accept(b & 0xFF);
    }

    @Override
    public void write(byte[] b, int off, int len) {
        if (binary) return;
        for (int i = off; i < off + len; i++) {
            accept(b[i] & 0xFF);
        }
    }

    private void accept(int b) {
        if (binary) return;
        if (b == 0) {
            binary = true;
            counts.clear();
            return;
        }
        if (Tokenizer.isTokenByte(b)) {
            if (runLength < run.length) {
                run[runLength] = (byte) Tokenizer.lower(b);
            }
            runLength++;
        } else {
            endRun();
        }
    }

    private void endRun() {
        if (runLength > Tokenizer.MAX_TOKEN_LENGTH) {
            oversized = true;
        } else if (runLength >= Tokenizer.MIN_TOKEN_LENGTH) {
            counts.merge(new String(run, 0, runLength, StandardCharsets.ISO_8859_1), 1, Integer::sum);
        }
        runLength = 0;
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            if (!binary) endRun();
        }
    }

    public boolean isBinary() {
        return binary;
    }

    /**
     * Whether {@link #counts()} holds every word of length two or more, so a
     * search may rely on it instead of decoding the content.
     */
    public boolean isComplete() {
        close();
        return !binary && !oversized;
    }

    /**
     * Token counts; completes the trailing word first.
     */
    public Map<String, Integer> counts() {
        close();
        return binary ? Map.of() : Map.copyOf(counts);
    }
}
