package com.astralcore.common.error;

/**
 * Thrown when a notification gateway fails to accept a message that gates authentication
 * (for example an SMS one-time code).
 */
public class DeliveryFailureException extends AstralSecurityException {

    private final String channel;

    public DeliveryFailureException(String channel, Throwable cause) {
        super(ErrorCategory.INTERNAL_ERROR, "Failed to deliver message via " + channel, cause);
        this.channel = channel;
    }

    public String channel() {
        return channel;
    }
}
