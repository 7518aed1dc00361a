package com.astralcore.crypto;

import com.astralcore.common.error.IntegrityFailureException;
import com.astralcore.observability.SecurityMarkers;
import com.astralcore.observability.SecurityMetrics;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Authenticated encryption of PHI values and binary attachments.
 * <p>
 * Every call derives a fresh AES-256 key from the master key with PBKDF2-HMAC-SHA256 over a
 * random 64-byte salt, then encrypts with AES-GCM under a random 16-byte IV. The output blob
 * is {@code base64(salt ‖ iv ‖ tag ‖ ciphertext)}.
 * <p>
 * Decryption fails closed: a blob that is not base64, is truncated, or whose tag does not
 * verify raises {@link IntegrityFailureException} and no plaintext is returned.
 */
public final class EncryptionService {

    private static final Logger log = LoggerFactory.getLogger(EncryptionService.class);

    public static final int SALT_LENGTH = 64;
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;
    public static final int KEY_LENGTH = 32;
    public static final int DEFAULT_ITERATIONS = 100_000;

    private static final int HEADER_LENGTH = SALT_LENGTH + IV_LENGTH + TAG_LENGTH;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final KeyMaterial keyMaterial;
    private final int iterations;
    private final SecureRandom random;
    private final SecurityMetrics metrics;

    public EncryptionService(KeyMaterial keyMaterial, SecurityMetrics metrics) {
        this(keyMaterial, DEFAULT_ITERATIONS, new SecureRandom(), metrics);
    }

    /**
     * @param keyMaterial the master key
     * @param iterations  PBKDF2 iteration count; lower values are only for development
     * @param random      source of salts and IVs
     * @param metrics     integrity failure counter
     */
    public EncryptionService(KeyMaterial keyMaterial, int iterations, SecureRandom random,
                             SecurityMetrics metrics) {
        if (keyMaterial == null) {
            throw new IllegalArgumentException("keyMaterial must not be null");
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.keyMaterial = keyMaterial;
        this.iterations = iterations;
        this.random = random;
        this.metrics = metrics;
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        return encryptBytes(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    public String decrypt(String blob) {
        return new String(decryptBytes(blob), StandardCharsets.UTF_8);
    }

    /**
     * Encrypts a binary payload (for example a file attachment) into the same blob format
     * as {@link #encrypt(String)}.
     */
    public String encryptBytes(byte[] plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        byte[] salt = new byte[SALT_LENGTH];
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(salt);
        random.nextBytes(iv);

        byte[] sealed;
        byte[] key = deriveKey(salt);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, iv));
            sealed = cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }

        // JCA appends the tag to the ciphertext; the blob stores it before.
        int ciphertextLength = sealed.length - TAG_LENGTH;
        byte[] blob = new byte[HEADER_LENGTH + ciphertextLength];
        System.arraycopy(salt, 0, blob, 0, SALT_LENGTH);
        System.arraycopy(iv, 0, blob, SALT_LENGTH, IV_LENGTH);
        System.arraycopy(sealed, ciphertextLength, blob, SALT_LENGTH + IV_LENGTH, TAG_LENGTH);
        System.arraycopy(sealed, 0, blob, HEADER_LENGTH, ciphertextLength);
        return Base64.getEncoder().encodeToString(blob);
    }

    public byte[] decryptBytes(String encoded) {
        if (encoded == null) {
            throw integrityFailure("blob is null", null);
        }
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw integrityFailure("blob is not valid base64", e);
        }
        if (blob.length < HEADER_LENGTH) {
            throw integrityFailure("blob is truncated", null);
        }

        byte[] salt = Arrays.copyOfRange(blob, 0, SALT_LENGTH);
        byte[] iv = Arrays.copyOfRange(blob, SALT_LENGTH, SALT_LENGTH + IV_LENGTH);
        int ciphertextLength = blob.length - HEADER_LENGTH;
        byte[] sealed = new byte[ciphertextLength + TAG_LENGTH];
        System.arraycopy(blob, HEADER_LENGTH, sealed, 0, ciphertextLength);
        System.arraycopy(blob, SALT_LENGTH + IV_LENGTH, sealed, ciphertextLength, TAG_LENGTH);

        byte[] key = deriveKey(salt);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw integrityFailure("authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw integrityFailure("decryption failed", e);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    public int iterations() {
        return iterations;
    }

    private byte[] deriveKey(byte[] salt) {
        byte[] master = keyMaterial.bytes();
        try {
            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(master, salt, iterations);
            return ((KeyParameter) generator.generateDerivedParameters(KEY_LENGTH * 8)).getKey();
        } finally {
            Arrays.fill(master, (byte) 0);
        }
    }

    private IntegrityFailureException integrityFailure(String reason, Throwable cause) {
        metrics.integrityFailure("encryption");
        log.warn(SecurityMarkers.SECURITY, "Rejected encrypted blob: {}", reason);
        return new IntegrityFailureException("Encrypted data failed integrity verification", cause);
    }
}
