package com.astralcore.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts protected health information and credentials from structured log and audit data.
 * <p>
 * Field names are matched case-insensitively against a set of substrings covering
 * credentials (password, token, secret, one-time codes) and PHI (email, phone, address, names,
 * dates of birth, clinical notes). Nested maps are redacted recursively.
 */
public final class PhiRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential",
            "backupcode", "verificationcode", "otp", "cookie", "masterkey",
            "email", "phone", "address", "firstname", "lastname", "dateofbirth", "ssn",
            "diagnosis", "symptom", "notes", "content", "concern"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public PhiRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns field name substrings to treat as sensitive (case-insensitive)
     */
    public PhiRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}. Null input
     * returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(key, redact(stringKeyed(nested)));
            } else {
                result.put(key, value);
            }
        }
        return result;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    /**
     * Masks an email address for display: {@code jane.doe@example.com} becomes
     * {@code j***@example.com}.
     */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) {
            return REDACTED;
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return REDACTED;
        }
        return email.charAt(0) + "***" + email.substring(at);
    }

    /**
     * Masks a phone number down to its last four digits: {@code ***1234}.
     */
    public static String maskPhone(String phone) {
        if (phone == null) {
            return REDACTED;
        }
        String digits = phone.replaceAll("\\D", "");
        if (digits.length() < 4) {
            return REDACTED;
        }
        return "***" + digits.substring(digits.length() - 4);
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
