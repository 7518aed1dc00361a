package com.astralcore.security.mfa;

/**
 * Transport a {@link NotificationGateway} delivers on. {@code IN_APP} recipients are user ids.
 */
public enum DeliveryChannel {
    SMS,
    EMAIL,
    IN_APP
}
