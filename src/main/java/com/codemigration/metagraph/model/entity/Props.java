package com.codemigration.metagraph.model.entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lenient readers for values coming back out of a property bag. Stores return numbers
 * as whatever width they like and lists as whatever implementation they like.
 */
public final class Props {

    private Props() {
    }

    public static String str(Object value) {
        return value == null ? null : value.toString();
    }

    public static String str(Object value, String fallback) {
        return value == null ? fallback : value.toString();
    }

    public static int intValue(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static long longValue(Object value, long fallback) {
        return value instanceof Number number ? number.longValue() : fallback;
    }

    public static double doubleValue(Object value, double fallback) {
        return value instanceof Number number ? number.doubleValue() : fallback;
    }

    public static boolean bool(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    public static Map<String, Object> map(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> raw) {
            raw.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    public static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        map(value).forEach((k, v) -> {
            if (v != null) {
                result.put(k, v.toString());
            }
        });
        return result;
    }

    public static List<Map<String, Object>> maps(Object value) {
        List<Map<String, Object>> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?>) {
                    result.add(map(item));
                }
            }
        }
        return result;
    }

    public static Map<String, Provenance> provenance(Object value) {
        Map<String, Provenance> result = new LinkedHashMap<>();
        map(value).forEach((k, v) -> result.put(k, Provenance.fromTag(str(v))));
        return result;
    }

    public static Map<String, Object> provenanceTags(Map<String, Provenance> provenance) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (provenance != null) {
            provenance.forEach((k, v) -> result.put(k, v.tag()));
        }
        return result;
    }

    /**
     * Everything in {@code properties} that is not one of the typed fields.
     */
    public static Map<String, Object> extras(Map<String, Object> properties, Set<String> known) {
        Map<String, Object> extra = new LinkedHashMap<>();
        properties.forEach((k, v) -> {
            if (!known.contains(k) && !"project_id".equals(k) && !"key".equals(k)) {
                extra.put(k, v);
            }
        });
        return extra;
    }

    /**
     * Adds extras without letting them shadow typed fields.
     */
    public static void mergeExtras(Map<String, Object> target, Map<String, Object> extra) {
        if (extra != null) {
            extra.forEach(target::putIfAbsent);
        }
    }
}
