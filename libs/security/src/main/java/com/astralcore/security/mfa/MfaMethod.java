package com.astralcore.security.mfa;

/**
 * Second factors a user can enroll.
 */
public enum MfaMethod {
    TOTP,
    SMS,
    EMAIL;

    /**
     * Delivery channel for one-time codes, or {@code null} for TOTP.
     */
    public DeliveryChannel deliveryChannel() {
        return switch (this) {
            case SMS -> DeliveryChannel.SMS;
            case EMAIL -> DeliveryChannel.EMAIL;
            case TOTP -> null;
        };
    }
}
