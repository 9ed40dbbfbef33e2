package com.signalfusion.common.extract;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single boundary for reading numbers out of loosely-typed specialist payloads.
 *
 * <p>Specialists return numbers raw ({@code 150.5}), nested ({@code {"value": 150.5}}),
 * under a descriptive key ({@code {"price": "150.5"}}) or as formatted text
 * ({@code "$1,234.50"}, {@code "12.5%"}). Every call site goes through this class
 * instead of casting ad hoc.
 *
 * <h3>Fallback order</h3>
 * <ol>
 *   <li>direct {@link Number}</li>
 *   <li>map: the {@code "value"} sub-key, recursively</li>
 *   <li>map: the first of {@code price, amount, total, number, val} that yields a number</li>
 *   <li>string parse after stripping {@code , $ %} and whitespace</li>
 *   <li>the caller's default</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.
 */
public final class ValueExtractor {

    private static final List<String> KNOWN_KEYS = List.of("price", "amount", "total", "number", "val");

    private ValueExtractor() {}

    /**
     * Extracts a finite number from {@code raw}, or null if none of the fallbacks apply.
     */
    public static Double number(Object raw) {
        if (raw == null) return null;

        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }

        if (raw instanceof Map<?, ?> map) {
            if (map.containsKey("value")) {
                Double nested = number(map.get("value"));
                if (nested != null) return nested;
            }
            for (String key : KNOWN_KEYS) {
                if (map.containsKey(key)) {
                    Double nested = number(map.get(key));
                    if (nested != null) return nested;
                }
            }
            return null;
        }

        if (raw instanceof CharSequence text) {
            return parse(text.toString());
        }
        return null;
    }

    /** As {@link #number(Object)} but falls back to {@code defaultValue}. */
    public static double number(Object raw, double defaultValue) {
        Double value = number(raw);
        return value != null ? value : defaultValue;
    }

    /**
     * Reads the first key of {@code payload} that yields a number.
     * Returns null when the payload is null or no key matches.
     */
    public static Double firstNumber(Map<String, ?> payload, String... keys) {
        if (payload == null) return null;
        for (String key : keys) {
            Double value = number(payload.get(key));
            if (value != null) return value;
        }
        return null;
    }

    /** Extracts a price; non-positive values are treated as absent. */
    public static Double price(Object raw) {
        Double value = number(raw);
        return (value != null && value > 0.0) ? value : null;
    }

    /** Reads the first key of {@code payload} that yields a strictly positive price. */
    public static Double firstPrice(Map<String, ?> payload, String... keys) {
        if (payload == null) return null;
        for (String key : keys) {
            Double value = price(payload.get(key));
            if (value != null) return value;
        }
        return null;
    }

    /** Reads a text field, trimmed and lower-cased; null when missing or blank. */
    public static String text(Map<String, ?> payload, String key) {
        if (payload == null) return null;
        Object raw = payload.get(key);
        if (raw == null) return null;
        String s = String.valueOf(raw).trim();
        return s.isEmpty() ? null : s.toLowerCase(Locale.ROOT);
    }

    private static Double parse(String text) {
        String cleaned = text.replace(",", "").replace("$", "").replace("%", "").trim();
        if (cleaned.isEmpty()) return null;
        try {
            double d = Double.parseDouble(cleaned);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
