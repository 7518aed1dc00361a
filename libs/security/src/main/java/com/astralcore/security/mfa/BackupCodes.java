package com.astralcore.security.mfa;

import com.astralcore.crypto.PasswordHasher;
import com.astralcore.crypto.SecureTokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Single-use recovery codes of the form {@code XXXX-XXXX} over {@code [A-Z0-9]}.
 * <p>
 * Codes are stored as salted PBKDF2 hashes. Matching hashes the presented code against
 * every stored hash, even after a match, so the time taken does not reveal the position
 * of the matching code.
 */
public final class BackupCodes {

    public static final int DEFAULT_COUNT = 10;
    public static final int DEFAULT_HASH_ITERATIONS = 10_000;

    private static final int GROUP_LENGTH = 4;

    private final PasswordHasher hasher;

    public BackupCodes(PasswordHasher hasher) {
        if (hasher == null) {
            throw new IllegalArgumentException("hasher must not be null");
        }
        this.hasher = hasher;
    }

    public List<String> generate(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive");
        }
        List<String> codes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            codes.add(SecureTokens.randomCode(SecureTokens.UPPER_ALPHANUMERIC, GROUP_LENGTH)
                    + "-"
                    + SecureTokens.randomCode(SecureTokens.UPPER_ALPHANUMERIC, GROUP_LENGTH));
        }
        return codes;
    }

    public List<String> hashAll(List<String> codes) {
        return codes.stream().map(code -> hasher.hash(normalize(code))).toList();
    }

    /**
     * Index of the stored hash matching {@code code}, if any.
     */
    public OptionalInt match(String code, List<String> hashedCodes) {
        if (code == null) {
            return OptionalInt.empty();
        }
        String normalized = normalize(code);
        int found = -1;
        for (int i = 0; i < hashedCodes.size(); i++) {
            if (hasher.verify(normalized, hashedCodes.get(i)) && found < 0) {
                found = i;
            }
        }
        return found < 0 ? OptionalInt.empty() : OptionalInt.of(found);
    }

    /**
     * Upper-cases and strips whitespace so {@code "abcd-1234 "} matches {@code ABCD-1234}.
     */
    static String normalize(String code) {
        return code.strip().toUpperCase(Locale.ROOT);
    }
}
