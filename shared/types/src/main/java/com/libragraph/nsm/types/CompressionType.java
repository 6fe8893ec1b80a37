package com.libragraph.nsm.types;

/**
 * Compression algorithm applied to every frame of an archive.
 * The tag is the byte recorded in the archive header.
 */
public enum CompressionType {
    ZSTD(1, "zstd"),
    DEFLATE(2, "deflate"),
    BZIP2(3, "bzip2");

    private final int tag;
    private final String label;

    CompressionType(int tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public int tag() {
        return tag;
    }

    public String label() {
        return label;
    }

    public static CompressionType fromTag(int tag) {
        for (CompressionType t : values()) {
            if (t.tag == tag) return t;
        }
        throw new IllegalArgumentException("Unknown compression tag: " + tag);
    }

    /**
     * Parses a label ("zstd") or enum name ("ZSTD"), case-insensitively.
     */
    public static CompressionType fromLabel(String label) {
        for (CompressionType t : values()) {
            if (t.label.equalsIgnoreCase(label) || t.name().equalsIgnoreCase(label)) return t;
        }
        throw new IllegalArgumentException("Unknown compression algorithm: " + label);
    }
}
