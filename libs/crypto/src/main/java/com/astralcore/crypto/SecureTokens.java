package com.astralcore.crypto;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.security.SecureRandom;

/**
 * Random identifiers, nonces and one-time codes from a cryptographically secure source.
 * <p>
 * Character selection uses {@link SecureRandom#nextInt(int)}, which is uniform over the
 * alphabet, so codes carry no modulo bias.
 */
public final class SecureTokens {

    public static final String ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    public static final String UPPER_ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    public static final String DIGITS = "0123456789";

    private static final SecureRandom RANDOM = new SecureRandom();

    private SecureTokens() {
        // Utility class
    }

    /**
     * Returns {@code byteCount} random bytes as lowercase hex ({@code 2 * byteCount} chars).
     */
    public static String randomToken(int byteCount) {
        if (byteCount < 1) {
            throw new IllegalArgumentException("byteCount must be positive");
        }
        byte[] bytes = new byte[byteCount];
        RANDOM.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }

    public static byte[] randomBytes(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
        byte[] bytes = new byte[count];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    public static String randomAlnum(int length) {
        return randomCode(ALPHANUMERIC, length);
    }

    public static String randomDigits(int length) {
        return randomCode(DIGITS, length);
    }

    public static String randomCode(String alphabet, int length) {
        if (alphabet == null || alphabet.isEmpty()) {
            throw new IllegalArgumentException("alphabet must not be null or empty");
        }
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    /**
     * SHA-256 of the UTF-8 input, truncated to {@code hexChars} hex characters. Used for
     * non-secret identifiers such as device fingerprints and anonymous rate-limit keys.
     */
    public static String sha256Prefix(String input, int hexChars) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        if (hexChars < 1 || hexChars > 64) {
            throw new IllegalArgumentException("hexChars must be between 1 and 64");
        }
        return DigestUtils.sha256Hex(input).substring(0, hexChars);
    }
}
