package com.astralcore.security.mfa;

import java.time.Instant;

/**
 * A one-time code sent over SMS or email, held in memory until used or expired.
 */
record VerificationCode(String code, DeliveryChannel channel, Instant expiresAt) {

    boolean expired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "VerificationCode[channel=" + channel + ", expiresAt=" + expiresAt + "]";
    }
}
