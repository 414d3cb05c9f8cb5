package com.flowys.flowys_backend.executor;

import java.util.List;
import java.util.Map;

/** Typed reads from the loosely-typed node config maps. */
public final class ConfigValues {

    private ConfigValues() {}

    public static String string(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof String s ? s : null;
    }

    public static String string(Map<String, Object> config, String key, String fallback) {
        String value = string(config, key);
        return value != null && !value.isBlank() ? value : fallback;
    }

    public static boolean isBlank(Map<String, Object> config, String key) {
        String value = string(config, key);
        return value == null || value.isBlank();
    }

    public static Double number(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static boolean flag(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Boolean b ? b : "true".equals(value);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    public static List<?> list(Map<String, Object> config, String key) {
        Object value = config.get(key);
        return value instanceof List<?> l ? l : null;
    }
}
