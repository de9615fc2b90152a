package io.safefetch.core;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Case-insensitive header helpers.
 */
public final class Headers {
    private Headers() {}

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";
    public static final String FORM_URLENCODED = "application/x-www-form-urlencoded;charset=UTF-8";

    /**
     * Returns a mutable copy whose keys compare case-insensitively. Null names and values are dropped.
     */
    public static TreeMap<String, String> copyOf(Map<String, String> headers) {
        TreeMap<String, String> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers == null) return out;
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    /**
     * Merges two header sets; {@code overrides} wins on a case-insensitive key collision.
     */
    public static Map<String, String> merge(Map<String, String> defaults, Map<String, String> overrides) {
        TreeMap<String, String> out = copyOf(defaults);
        if (overrides != null) {
            for (Map.Entry<String, String> e : overrides.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                // remove first so the caller's spelling of the name is kept
                out.remove(e.getKey());
                out.put(e.getKey(), e.getValue());
            }
        }
        return Collections.unmodifiableMap(out);
    }

    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                Iterable<String> vals = e.getValue();
                if (vals == null) return Optional.empty();
                for (String v : vals) {
                    if (v != null) return Optional.of(v);
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
