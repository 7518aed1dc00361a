package com.astralcore.securityservice.notification;

import com.astralcore.observability.PhiRedactor;
import com.astralcore.security.mfa.DeliveryChannel;
import com.astralcore.security.mfa.NotificationGateway;
import com.astralcore.security.mfa.NotificationPayload;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-in gateway for deployments without an SMS or email provider. It logs that a message
 * would have been sent, with the recipient masked; message bodies carry codes and are never
 * logged.
 */
public class LoggingNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationGateway.class);

    @Override
    public CompletableFuture<Void> deliver(DeliveryChannel channel, String recipient,
                                           NotificationPayload payload) {
        log.info("Notification [{}] via {} to {}", payload.category(), channel, mask(channel, recipient));
        return CompletableFuture.completedFuture(null);
    }

    static String mask(DeliveryChannel channel, String recipient) {
        return switch (channel) {
            case SMS -> PhiRedactor.maskPhone(recipient);
            case EMAIL -> PhiRedactor.maskEmail(recipient);
            case IN_APP -> recipient;
        };
    }
}
