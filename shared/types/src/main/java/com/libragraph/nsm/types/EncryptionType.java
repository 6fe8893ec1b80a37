package com.libragraph.nsm.types;

public enum EncryptionType {
    NONE(0, "none"),
    AES_256_GCM(1, "aes-256-gcm");

    private final int tag;
    private final String label;

    EncryptionType(int tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public int tag() {
        return tag;
    }

    public String label() {
        return label;
    }

    public static EncryptionType fromTag(int tag) {
        for (EncryptionType t : values()) {
            if (t.tag == tag) return t;
        }
        throw new IllegalArgumentException("Unknown encryption tag: " + tag);
    }
}
