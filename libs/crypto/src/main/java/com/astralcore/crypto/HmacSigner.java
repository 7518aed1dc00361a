package com.astralcore.crypto;

import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * HMAC-SHA256 signing with hex output, plus the constant-time comparison every signature
 * check in the substrate goes through.
 */
public final class HmacSigner {

    private static final int MIN_SECRET_LENGTH = 32;

    private final byte[] secret;

    public HmacSigner(byte[] secret) {
        if (secret == null || secret.length < MIN_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "secret must be at least %d bytes".formatted(MIN_SECRET_LENGTH));
        }
        this.secret = secret.clone();
    }

    public static HmacSigner fromSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        return new HmacSigner(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String sign(String payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(secret));
        byte[] input = payload.getBytes(StandardCharsets.UTF_8);
        hmac.update(input, 0, input.length);
        byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return Hex.encodeHexString(out);
    }

    /**
     * Whether {@code signature} is the signature of {@code payload}, compared in constant time.
     */
    public boolean verify(String payload, String signature) {
        if (payload == null || signature == null) {
            return false;
        }
        return constantTimeEquals(sign(payload), signature);
    }

    /**
     * Compares two strings without short-circuiting on the first differing character.
     * Null on either side compares unequal.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
