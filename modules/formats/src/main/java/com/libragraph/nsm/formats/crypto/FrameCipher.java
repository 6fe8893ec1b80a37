package com.libragraph.nsm.formats.crypto;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import org.apache.commons.io.output.CloseShieldOutputStream;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.CipherInputStream;
import javax.crypto.CipherOutputStream;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM sealing of frames and of the index block.
 *
 * Stored form: {@code nonce(12) || ciphertext || tag(16)}. The associated
 * data is the entry path, so a frame cannot be swapped onto another entry.
 */
public final class FrameCipher {

    public static final int KEY_LENGTH = 32;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    /** Bytes added to every sealed frame. */
    public static final int OVERHEAD = NONCE_LENGTH + TAG_LENGTH;
    public static final String INDEX_AAD = "index";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public FrameCipher(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("AES-256 key must be " + KEY_LENGTH + " bytes");
        }
        this.key = new SecretKeySpec(key.clone(), "AES");
    }

    /**
     * Parses a Base64 encoded 32-byte key.
     */
    public static FrameCipher fromBase64(String encoded) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key is not valid Base64", e);
        }
        return new FrameCipher(raw);
    }

    public static String generateKey() {
        byte[] raw = new byte[KEY_LENGTH];
        new SecureRandom().nextBytes(raw);
        return Base64.getEncoder().encodeToString(raw);
    }

    /**
     * Writes a fresh nonce to {@code sink} and returns a stream that encrypts
     * onto it. Closing the stream appends the tag; {@code sink} stays open.
     */
    public OutputStream encrypt(OutputStream sink, String aad) throws IOException {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        Cipher cipher = init(Cipher.ENCRYPT_MODE, nonce, aad);
        sink.write(nonce);
        return new CipherOutputStream(CloseShieldOutputStream.wrap(sink), cipher);
    }

    /**
     * Reads the nonce from {@code source} and returns a stream of plaintext.
     * A failed tag check surfaces as {@link ArchiveError#CHECKSUM_MISMATCH}.
     */
    public InputStream decrypt(InputStream source, String aad) throws IOException {
        byte[] nonce = source.readNBytes(NONCE_LENGTH);
        if (nonce.length != NONCE_LENGTH) {
            throw new ArchiveException(ArchiveError.INVALID_FORMAT,
                    "Encrypted frame for " + aad + " shorter than its nonce");
        }
        Cipher cipher = init(Cipher.DECRYPT_MODE, nonce, aad);
        return new TagCheckingInputStream(new CipherInputStream(source, cipher), aad);
    }

    public byte[] seal(byte[] plaintext, String aad) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(plaintext.length + OVERHEAD);
        try (OutputStream enc = encrypt(out, aad)) {
            enc.write(plaintext);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public byte[] open(byte[] sealed, String aad) {
        try (InputStream dec = decrypt(new ByteArrayInputStream(sealed), aad)) {
            return dec.readAllBytes();
        } catch (IOException e) {
            throw new ArchiveException(ArchiveError.ARCHIVE_READ_FAILURE,
                    "Failed to decrypt " + aad + ": " + e.getMessage(), e);
        }
    }

    private Cipher init(int mode, byte[] nonce, String aad) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(mode, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            cipher.updateAAD(aad.getBytes(StandardCharsets.UTF_8));
            return cipher;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM unavailable", e);
        }
    }

    private static final class TagCheckingInputStream extends FilterInputStream {
        private final String aad;

        TagCheckingInputStream(InputStream in, String aad) {
            super(in);
            this.aad = aad;
        }

        @Override
        public int read() throws IOException {
            try {
                return super.read();
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            try {
                return super.read(b, off, len);
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } catch (IOException e) {
                throw translate(e);
            }
        }

        private IOException translate(IOException e) {
            for (Throwable t = e; t != null; t = t.getCause()) {
                if (t instanceof AEADBadTagException) {
                    throw new ArchiveException(ArchiveError.CHECKSUM_MISMATCH,
                            "Authentication failed for " + aad, e);
                }
            }
            return e;
        }
    }
}
