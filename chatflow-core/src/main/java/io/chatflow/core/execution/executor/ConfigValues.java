package io.chatflow.core.execution.executor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/// Typed reads from an opaque node configuration map.
///
/// Numbers may arrive as numbers or numeric strings depending on the
/// definition source; both are accepted. Malformed values throw
/// {@link IllegalArgumentException}, which executors report as a node failure.
final class ConfigValues {

    private ConfigValues() {}

    static String string(Map<String, Object> config, String key, String fallback) {
        Object value = config.get(key);
        return value != null ? value.toString() : fallback;
    }

    static boolean hasText(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value != null && !value.toString().isBlank();
    }

    static double decimal(Map<String, Object> config, String key, double fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be a number: " + value, e);
        }
    }

    static int integer(Map<String, Object> config, String key, int fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer: " + value, e);
        }
    }

    static boolean bool(Map<String, Object> config, String key, boolean fallback) {
        Object value = config.get(key);
        if (value == null) {
            return fallback;
        }
        return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
    }

    /// Reads `timeout` in seconds, falling back to the turn default.
    static Duration timeout(Map<String, Object> config, Duration fallback) {
        if (config.get("timeout") == null) {
            return fallback;
        }
        int seconds = integer(config, "timeout", (int) fallback.toSeconds());
        if (seconds <= 0) {
            throw new IllegalArgumentException("'timeout' must be positive: " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    static Map<String, Object> map(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> raw) {
            Map<String, Object> copy = new LinkedHashMap<>();
            raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        throw new IllegalArgumentException("'" + key + "' must be an object");
    }

    static String truncate(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) : text;
    }
}
