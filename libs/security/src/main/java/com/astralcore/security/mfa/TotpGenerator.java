package com.astralcore.security.mfa;

import com.astralcore.crypto.HmacSigner;
import com.astralcore.crypto.SecureTokens;
import org.apache.commons.codec.binary.Base32;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * RFC 6238 time-based one-time passwords: HMAC-SHA1, 30-second steps, 6 digits.
 * <p>
 * Verification accepts codes from {@code window} steps either side of the current one and
 * evaluates every candidate step, so timing does not reveal which step matched.
 */
public final class TotpGenerator {

    public static final int SECRET_BYTES = 20;
    public static final int TIME_STEP_SECONDS = 30;
    public static final int CODE_DIGITS = 6;
    public static final int DEFAULT_WINDOW = 2;

    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000};

    private final Clock clock;
    private final int window;

    public TotpGenerator(Clock clock) {
        this(clock, DEFAULT_WINDOW);
    }

    public TotpGenerator(Clock clock, int window) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (window < 0) {
            throw new IllegalArgumentException("window must not be negative");
        }
        this.clock = clock;
        this.window = window;
    }

    /**
     * A new 160-bit secret, Base32 without padding.
     */
    public String generateSecret() {
        return new Base32().encodeToString(SecureTokens.randomBytes(SECRET_BYTES)).replace("=", "");
    }

    public String codeAt(String secret, Instant instant) {
        return codeForStep(decode(secret), instant.getEpochSecond() / TIME_STEP_SECONDS);
    }

    public boolean verify(String secret, String code) {
        if (secret == null || code == null || !code.matches("\\d{" + CODE_DIGITS + "}")) {
            return false;
        }
        byte[] key = decode(secret);
        long current = clock.instant().getEpochSecond() / TIME_STEP_SECONDS;
        boolean matched = false;
        for (long step = current - window; step <= current + window; step++) {
            matched |= HmacSigner.constantTimeEquals(codeForStep(key, step), code);
        }
        return matched;
    }

    /**
     * The {@code otpauth://} provisioning URI rendered as a QR code by authenticator apps.
     */
    public String provisioningUri(String issuer, String accountName, String secret) {
        String label = encode(issuer) + ":" + encode(accountName);
        return "otpauth://totp/" + label
                + "?secret=" + secret
                + "&issuer=" + encode(issuer)
                + "&algorithm=SHA1"
                + "&digits=" + CODE_DIGITS
                + "&period=" + TIME_STEP_SECONDS;
    }

    private static String codeForStep(byte[] key, long step) {
        HMac hmac = new HMac(new SHA1Digest());
        hmac.init(new KeyParameter(key));
        byte[] counter = ByteBuffer.allocate(Long.BYTES).putLong(step).array();
        hmac.update(counter, 0, counter.length);
        byte[] hash = new byte[hmac.getMacSize()];
        hmac.doFinal(hash, 0);

        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        int otp = binary % POWERS_OF_TEN[CODE_DIGITS];
        return String.format("%0" + CODE_DIGITS + "d", otp);
    }

    private static byte[] decode(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        return new Base32().decode(secret.toUpperCase(Locale.ROOT));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
