package com.integrationhealth.core.logging;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scrubs credentials from probe error text and detail payloads before they are logged, stored or returned.
 * <p>
 * Probe code paths handle decrypted tokens, so any exception message may echo one back. Text is matched
 * case-insensitively against bearer tokens, {@code Authorization:} header values, {@code token=} / {@code token:}
 * pairs and Discord webhook URLs. String detail values under a sensitive-looking key are replaced outright;
 * booleans and numbers are kept so flags such as {@code tokenValid} survive.
 */
public final class ProbeErrorSanitizer {

    public static final String REDACTED = "[REDACTED]";
    public static final String UNKNOWN_ERROR = "Unknown probe error";

    private static final List<Replacement> REPLACEMENTS = List.of(
        new Replacement(Pattern.compile("Bearer\\s+[^\\s\"'}]+", Pattern.CASE_INSENSITIVE), "Bearer " + REDACTED),
        new Replacement(Pattern.compile("Authorization:\\s*[^\\s\"'}]+", Pattern.CASE_INSENSITIVE), "Authorization: " + REDACTED),
        new Replacement(Pattern.compile("token[=:]\\s*[^\\s\"'}]+", Pattern.CASE_INSENSITIVE), "token=" + REDACTED),
        new Replacement(Pattern.compile("(https?://[^\\s\"'/]+)/api/webhooks/[^\\s\"'}]+", Pattern.CASE_INSENSITIVE), "$1/api/webhooks/" + REDACTED)
    );

    private static final Pattern SENSITIVE_KEY =
        Pattern.compile("token|secret|authorization|password|apikey|credential", Pattern.CASE_INSENSITIVE);

    private ProbeErrorSanitizer() {}

    public static String sanitize(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String sanitized = message;
        for (Replacement replacement : REPLACEMENTS) {
            sanitized = replacement.pattern().matcher(sanitized).replaceAll(replacement.value());
        }
        return sanitized;
    }

    /**
     * Message of an unexpected failure, sanitized. Falls back to {@value #UNKNOWN_ERROR} when the throwable
     * carries no message.
     */
    public static String sanitize(Throwable error) {
        String sanitized = error == null ? null : sanitize(error.getMessage());
        return sanitized != null ? sanitized : UNKNOWN_ERROR;
    }

    public static Map<String, Object> sanitizeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(details.size());
        details.forEach((key, value) -> result.put(key, sanitizeValue(key, value)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object sanitizeValue(String key, Object value) {
        if (value instanceof String text) {
            if (SENSITIVE_KEY.matcher(key).find()) {
                return REDACTED;
            }
            String sanitized = sanitize(text);
            return sanitized != null ? sanitized : text;
        }
        if (value instanceof Map<?, ?> nested) {
            return sanitizeDetails((Map<String, Object>) nested);
        }
        return value;
    }

    private record Replacement(Pattern pattern, String value) {}
}
