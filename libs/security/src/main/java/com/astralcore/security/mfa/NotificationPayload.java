package com.astralcore.security.mfa;

/**
 * A message handed to the notification gateway.
 *
 * @param category machine-readable kind, e.g. {@code mfa_code} or {@code security_alert}
 * @param subject  short title (used by email and in-app channels)
 * @param body     message text
 */
public record NotificationPayload(String category, String subject, String body) {

    public static final String CATEGORY_CODE = "mfa_code";
    public static final String CATEGORY_SECURITY_ALERT = "security_alert";

    public NotificationPayload {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
    }
}
