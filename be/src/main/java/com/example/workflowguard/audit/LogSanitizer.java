package com.example.workflowguard.audit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Makes untrusted text safe to keep in the audit trail and logs: redacts credential assignments and long
 * base64 runs, then truncates.
 */
public final class LogSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 500;
    public static final String TRUNCATED_SUFFIX = "... [TRUNCATED]";

    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|secret|api[_-]?key|key|token)\\s*[:=]\\s*[\"']?[^\\s\"',}]+[\"']?");
    private static final Pattern BASE64_RUN = Pattern.compile("[A-Za-z0-9+/]{40,}={0,2}");

    // Slack so that a secret straddling the cut is still seen whole by the patterns.
    private static final int REDACTION_WINDOW = 100;

    private LogSanitizer() {
    }

    public static String sanitize(String text) {
        return sanitize(text, DEFAULT_MAX_LENGTH);
    }

    public static String sanitize(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        String window = text.length() > maxLength + REDACTION_WINDOW
                ? text.substring(0, maxLength + REDACTION_WINDOW)
                : text;
        String redacted = SECRET_ASSIGNMENT.matcher(window).replaceAll("$1=[REDACTED]");
        redacted = BASE64_RUN.matcher(redacted).replaceAll("[REDACTED_BASE64]");
        if (redacted.length() > maxLength || text.length() > window.length()) {
            return redacted.substring(0, Math.min(maxLength, redacted.length())) + TRUNCATED_SUFFIX;
        }
        return redacted;
    }

    /** Sanitizes every string value of the map, descending into nested maps and lists. */
    public static Map<String, Object> sanitizeValues(Map<String, ?> values) {
        if (values == null) {
            return null;
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        values.forEach((k, v) -> sanitized.put(k, sanitizeValue(v)));
        return sanitized;
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof String text) {
            return sanitize(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), sanitizeValue(v)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(sanitizeValue(item));
            }
            return items;
        }
        return value;
    }
}
