package com.linlay.taskagent.gateway;

import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks credentials in logged LLM traffic.
 */
public final class LlmLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final List<String> SENSITIVE_HEADERS = List.of(
            HttpHeaders.AUTHORIZATION,
            "X-API-Key",
            "Api-Key",
            "OpenAI-Organization"
    );

    private LlmLogSanitizer() {
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safeHeaders = new HttpHeaders();
        if (headers == null) {
            return safeHeaders;
        }
        safeHeaders.putAll(headers);
        if (!maskSensitive) {
            return safeHeaders;
        }
        for (String key : SENSITIVE_HEADERS) {
            if (safeHeaders.containsKey(key)) {
                safeHeaders.set(key, "***");
            }
        }
        return safeHeaders;
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        return BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Cuts {@code text} to {@code maxChars}; a non-positive limit disables the cut.
     */
    public static String abbreviate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        if (maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...(" + (text.length() - maxChars) + " more chars)";
    }
}
