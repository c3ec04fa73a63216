package com.acme.furfolio.eventlog.util;

import java.util.Locale;
import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Designed for startup usage. Every getter has a {@code Map} overload so tests can
 * pass a fixed environment.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(String name, String defaultValue) {
        return getOrDefault(System.getenv(), name, defaultValue);
    }

    public static boolean getBoolean(String name, boolean defaultValue) {
        return getBoolean(System.getenv(), name, defaultValue);
    }

    public static int getIntClamped(String name, int defaultValue, int min, int max) {
        return getIntClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static long getLongClamped(String name, long defaultValue, long min, long max) {
        return getLongClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Resolves an enum constant by case-insensitive name, falling back on blank or unknown input.
     */
    public static <E extends Enum<E>> E getEnum(Map<String, String> env, String name, Class<E> type, E defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
