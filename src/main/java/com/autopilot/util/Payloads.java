package com.autopilot.util;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Чтение значений из JSON-полей (payload событий, настройки агентов).
 */
public final class Payloads {

    private Payloads() {
    }

    public static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map != null ? map.get(key) : null;
        if (value == null || String.valueOf(value).isBlank()) {
            return defaultValue;
        }
        return String.valueOf(value);
    }

    public static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map != null ? map.get(key) : null;
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map != null ? map.get(key) : null;
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return (int) Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map != null ? map.get(key) : null;
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value != null) {
            return Boolean.parseBoolean(String.valueOf(value).trim());
        }
        return defaultValue;
    }

    public static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map != null ? map.get(key) : null;
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map != null ? map.get(key) : null;
        if (value instanceof Map<?, ?> nested) {
            return (Map<String, Object>) nested;
        }
        return Map.of();
    }
}
