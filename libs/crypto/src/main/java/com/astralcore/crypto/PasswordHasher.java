package com.astralcore.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

/**
 * Salted slow hashing for passwords and MFA backup codes.
 * <p>
 * PBKDF2-HMAC-SHA512 with a 16-byte random salt and a 64-byte output, stored as
 * {@code saltHex:hashHex}. Verification recomputes with the stored salt and compares in
 * constant time; a malformed stored value verifies as {@code false}.
 */
public final class PasswordHasher {

    public static final int DEFAULT_ITERATIONS = 100_000;
    public static final int SALT_LENGTH = 16;
    public static final int HASH_LENGTH = 64;

    private final int iterations;
    private final SecureRandom random;

    public PasswordHasher() {
        this(DEFAULT_ITERATIONS);
    }

    public PasswordHasher(int iterations) {
        this(iterations, new SecureRandom());
    }

    public PasswordHasher(int iterations, SecureRandom random) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.iterations = iterations;
        this.random = random;
    }

    public String hash(String password) {
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        return Hex.encodeHexString(salt) + ":" + Hex.encodeHexString(derive(password, salt));
    }

    public boolean verify(String password, String stored) {
        if (password == null || stored == null) {
            return false;
        }
        int separator = stored.indexOf(':');
        if (separator <= 0 || separator != stored.lastIndexOf(':')) {
            return false;
        }
        byte[] salt;
        byte[] expected;
        try {
            salt = Hex.decodeHex(stored.substring(0, separator));
            expected = Hex.decodeHex(stored.substring(separator + 1));
        } catch (DecoderException e) {
            return false;
        }
        if (expected.length != HASH_LENGTH) {
            return false;
        }
        return MessageDigest.isEqual(expected, derive(password, salt));
    }

    public int iterations() {
        return iterations;
    }

    private byte[] derive(String password, byte[] salt) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA512Digest());
        generator.init(password.getBytes(StandardCharsets.UTF_8), salt, iterations);
        return ((KeyParameter) generator.generateDerivedParameters(HASH_LENGTH * 8)).getKey();
    }
}
