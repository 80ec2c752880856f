package de.jwiegmann.ultraupload.control.error;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bereinigt einen Fehlerkontext, bevor er gespeichert oder verschickt wird.
 *
 * <p>Sensible Schlüssel werden durch {@value #REDACTED} ersetzt, lange Texte gekürzt,
 * verschachtelte Maps rekursiv bereinigt. Andere Objekte erscheinen nur mit ihrem Klassennamen.</p>
 */
public class ContextSanitizer {

    public static final String REDACTED = "[REDACTED]";

    static final String TRUNCATED = "...[TRUNCATED]";

    public static final List<String> DEFAULT_SENSITIVE_KEYS = List.of(
            "password", "secret", "token", "auth", "key", "credentials", "authorization",
            "credit_card", "cvv", "api_key");

    private final Set<String> sensitiveKeys;
    private final int maxStringLength;

    public ContextSanitizer() {
        this(DEFAULT_SENSITIVE_KEYS, 500);
    }

    public ContextSanitizer(Collection<String> sensitiveKeys, int maxStringLength) {
        this.sensitiveKeys = sensitiveKeys.stream()
                .map(key -> key.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.maxStringLength = maxStringLength;
    }

    public Map<String, Object> sanitize(Map<?, ?> context) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (context == null) {
            return sanitized;
        }
        for (Map.Entry<?, ?> entry : context.entrySet()) {
            String key = String.valueOf(entry.getKey());
            sanitized.put(key, isSensitive(key) ? REDACTED : sanitizeValue(entry.getValue()));
        }
        return sanitized;
    }

    public String truncate(String value) {
        return truncate(value, maxStringLength);
    }

    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace("\0", "");
        if (cleaned.length() <= maxLength) {
            return cleaned;
        }
        return cleaned.substring(0, Math.max(0, maxLength - TRUNCATED.length())) + TRUNCATED;
    }

    boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        return sensitiveKeys.contains(lower)
                || lower.contains("password")
                || lower.contains("secret")
                || lower.contains("token")
                || lower.endsWith("_key");
    }

    private Object sanitizeValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof Enum) {
            return value;
        }
        if (value instanceof CharSequence) {
            return truncate(value.toString());
        }
        if (value instanceof Map) {
            return sanitize((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(this::sanitizeValue).collect(Collectors.toList());
        }
        return "[Object:" + value.getClass().getSimpleName() + "]";
    }
}
