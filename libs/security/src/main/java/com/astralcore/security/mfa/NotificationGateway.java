package com.astralcore.security.mfa;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound message delivery (SMS, email, in-app). Implementations live outside the
 * substrate; the returned future fails when the transport rejects the message.
 */
public interface NotificationGateway {

    CompletableFuture<Void> deliver(DeliveryChannel channel, String recipient, NotificationPayload payload);
}
