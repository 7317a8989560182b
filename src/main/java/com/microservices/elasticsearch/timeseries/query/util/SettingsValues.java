package com.microservices.elasticsearch.timeseries.query.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Typed reads over the loosely typed settings documents produced by the query editor.
 * Editor forms store most numbers as strings, so integer reads accept numeric strings too.
 */
public final class SettingsValues {
    private SettingsValues() {}

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,9}");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    public static Optional<String> string(Map<String, Object> settings, String key) {
        return settings != null && settings.get(key) instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public static String string(Map<String, Object> settings, String key, String defaultValue) {
        return string(settings, key).orElse(defaultValue);
    }

    /** Integer value of a number or a numeric string, empty otherwise or when outside the int range. */
    public static Optional<Integer> integer(Object value) {
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            return Optional.of(n instanceof Double || n instanceof Float ? (int) d : Math.toIntExact(n.longValue()));
        }
        if (value instanceof String s && INTEGER.matcher(s.trim()).matches()) {
            return Optional.of(Integer.parseInt(s.trim()));
        }
        return Optional.empty();
    }

    public static Optional<Integer> integer(Map<String, Object> settings, String key) {
        return settings == null ? Optional.empty() : integer(settings.get(key));
    }

    public static int integer(Map<String, Object> settings, String key, int defaultValue) {
        return integer(settings, key).orElse(defaultValue);
    }

    public static Optional<Double> decimal(String value) {
        if (value == null || !DECIMAL.matcher(value.trim()).matches()) {
            return Optional.empty();
        }
        return Optional.of(Double.parseDouble(value.trim()));
    }

    public static boolean isInteger(String value) {
        return value != null && INTEGER.matcher(value).matches();
    }

    public static boolean bool(Object value, boolean defaultValue) {
        return value instanceof Boolean b ? b : defaultValue;
    }

    /**
     * Copy of a JSON-like object with string keys, or an empty map when the value is not an object
     */
    public static Map<String, Object> object(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), deepCopy(v)));
        }
        return result;
    }

    public static List<Object> array(Object value) {
        List<Object> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.forEach(item -> result.add(deepCopy(item)));
        }
        return result;
    }

    /**
     * Recursively copies nested maps and lists so callers can rewrite the copy freely
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?>) {
            return object(value);
        }
        if (value instanceof List<?>) {
            return array(value);
        }
        return value;
    }
}
