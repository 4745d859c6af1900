package io.courier.security;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credential-looking values in message and task metadata before it is
 * written to the audit trail. Conversation metadata comes straight from the
 * chat transport and regularly carries tokens.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential", "cookie"
    );

    private SensitiveDataMasker() {
    }

    public static Map<String, Object> masked(Map<String, ?> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : input.entrySet()) {
            if (isSensitiveKey(entry.getKey())) {
                out.put(entry.getKey(), MASK);
            } else {
                out.put(entry.getKey(), maskedValue(entry.getValue()));
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object maskedValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return masked((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> values) {
            List<Object> out = new ArrayList<>(values.size());
            for (Object item : values) {
                out.add(maskedValue(item));
            }
            return out;
        }
        if (value instanceof String text && likelySecretValue(text)) {
            return MASK;
        }
        return value;
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || v.contains(" ")) {
            return false;
        }
        // Long opaque strings with no spaces are treated as tokens.
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$") && v.chars().anyMatch(Character::isDigit);
    }
}
