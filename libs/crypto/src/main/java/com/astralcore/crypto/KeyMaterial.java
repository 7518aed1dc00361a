package com.astralcore.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

import java.util.Arrays;

/**
 * The process-wide master key from which per-blob encryption keys are derived.
 * <p>
 * Held in memory for the lifetime of the process and never persisted. {@link #toString()}
 * never prints the key.
 */
public final class KeyMaterial {

    /** Minimum decoded key length in bytes. */
    public static final int MIN_LENGTH = 32;

    private final byte[] key;

    private KeyMaterial(byte[] key) {
        this.key = key;
    }

    /**
     * Parses a hex-encoded master key, as supplied through configuration.
     *
     * @throws IllegalArgumentException if the value is blank, not hex, or shorter than
     *                                  {@value #MIN_LENGTH} bytes
     */
    public static KeyMaterial fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("master key must not be null or blank");
        }
        byte[] decoded;
        try {
            decoded = Hex.decodeHex(hex.trim());
        } catch (DecoderException e) {
            throw new IllegalArgumentException("master key must be hex encoded", e);
        }
        return of(decoded);
    }

    public static KeyMaterial of(byte[] key) {
        if (key == null || key.length < MIN_LENGTH) {
            throw new IllegalArgumentException(
                    "master key must be at least %d bytes".formatted(MIN_LENGTH));
        }
        return new KeyMaterial(key.clone());
    }

    /**
     * Returns a copy of the key bytes. Callers should wipe the copy when done.
     */
    byte[] bytes() {
        return key.clone();
    }

    public int length() {
        return key.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyMaterial other && Arrays.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return "KeyMaterial[" + key.length + " bytes, REDACTED]";
    }
}
