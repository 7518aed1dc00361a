package com.astralcore.security.http;

import java.time.Duration;

/**
 * A {@code Set-Cookie} header value for security cookies. Cookies are always
 * {@code HttpOnly}, {@code SameSite=Strict} and scoped to {@code Path=/}; {@code Secure}
 * is added when requested (production).
 *
 * @param name   cookie name
 * @param value  cookie value
 * @param maxAge lifetime; {@link Duration#ZERO} expires the cookie immediately
 * @param secure whether to add the {@code Secure} attribute
 */
public record SetCookie(String name, String value, Duration maxAge, boolean secure) {

    public SetCookie {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (value == null) {
            value = "";
        }
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be null or negative");
        }
    }

    /**
     * A cookie that clears {@code name} on the client.
     */
    public static SetCookie expire(String name, boolean secure) {
        return new SetCookie(name, "", Duration.ZERO, secure);
    }

    public String headerValue() {
        StringBuilder sb = new StringBuilder()
                .append(name).append('=').append(value)
                .append("; Max-Age=").append(maxAge.toSeconds())
                .append("; Path=/")
                .append("; HttpOnly")
                .append("; SameSite=Strict");
        if (secure) {
            sb.append("; Secure");
        }
        return sb.toString();
    }
}
