package com.whereq.conductor.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials in free-text log messages before they are stored
 */
public final class LogSanitizer {

    public static final String REDACTED = "(redacted)";

    private static final List<Pattern> PATTERNS = List.of(
        // Authorization: Bearer abc / Token abc
        Pattern.compile("(?i)((?:authorization\\s*[:=]\\s*)?(?:bearer|token)\\s+)([A-Za-z0-9._~+/=-]+)"),
        // password=..., secret: ..., "token": "..."
        Pattern.compile("(?i)((?:password|passwd|secret|token|api[_-]?key)\"?\\s*[:=]\\s*\"?)([^\\s\",;&]+)")
    );

    private LogSanitizer() {
    }

    public static String sanitize(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String sanitized = message;
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(sanitized);
            sanitized = matcher.replaceAll(m -> Matcher.quoteReplacement(m.group(1) + REDACTED));
        }
        return sanitized;
    }
}
