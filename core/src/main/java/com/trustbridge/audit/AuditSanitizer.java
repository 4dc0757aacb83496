package com.trustbridge.audit;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secret-looking values before they reach an audit event.
 * <p>
 * Map entries are masked when their key names a sensitive field; free text is scanned for credential patterns.
 * A masked value keeps its last four characters as a hint.
 */
@UtilityClass
public class AuditSanitizer {

    private static final Pattern SENSITIVE_KEY = Pattern.compile("(?i).*(key|secret|password|token|credential|auth).*");

    // group 1 is kept, group 2 is masked
    private static final List<Pattern> SENSITIVE_TEXT = List.of(
            Pattern.compile("(?i)(bearer\\s+)([A-Za-z0-9._~+/=-]+)"),
            Pattern.compile("(?i)((?:password|passwd|pwd|secret|token|api[_-]?key)\\s*[=:]\\s*)([^\\s,;&\"']+)"),
            Pattern.compile("()(sk-[A-Za-z0-9_-]{8,})"),
            Pattern.compile("()(hf_[A-Za-z0-9]{8,})"),
            Pattern.compile("()(AIzaSy[A-Za-z0-9_-]{8,})"));

    public static boolean isSensitiveKey(String key) {
        return key != null && SENSITIVE_KEY.matcher(key).matches();
    }

    public static String mask(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= 4) {
            return "****";
        }
        return "***" + value.substring(value.length() - 4);
    }

    public static String sanitizeText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : SENSITIVE_TEXT) {
            Matcher matcher = pattern.matcher(result);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1) + mask(matcher.group(2))));
            }
            matcher.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }

    /**
     * @return a sanitized deep copy, the input is never modified
     */
    public static Map<String, Object> sanitizeData(Map<String, ?> data) {
        Map<String, Object> sanitized = new LinkedHashMap<>();
        if (data == null) {
            return sanitized;
        }
        data.forEach((key, value) -> sanitized.put(key, sanitizeEntry(key, value)));
        return sanitized;
    }

    private static Object sanitizeEntry(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (isSensitiveKey(key) && !(value instanceof Map<?, ?>) && !(value instanceof Iterable<?>)) {
            return mask(String.valueOf(value));
        }
        return sanitizeValue(value);
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), sanitizeEntry(String.valueOf(k), v)));
            return copy;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> copy = new ArrayList<>();
            iterable.forEach(v -> copy.add(sanitizeValue(v)));
            return copy;
        }
        if (value instanceof String s) {
            return sanitizeText(s);
        }
        return value;
    }
}
