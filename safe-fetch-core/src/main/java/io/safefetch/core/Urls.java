package io.safefetch.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * URL resolution against a base URL and query string construction.
 */
public final class Urls {
    private Urls() {}

    public static boolean isAbsolute(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * Resolves {@code url} against {@code baseUrl}.
     *
     * <p>Absolute URLs are returned untouched. Relative ones are appended to the base URL with
     * exactly one slash between the two.
     *
     * @param baseUrl the base URL, may be null or empty
     * @param url an absolute URL or a path
     * @return the resolved URL string
     */
    public static String resolve(String baseUrl, String url) {
        Objects.requireNonNull(url, "url");
        if (isAbsolute(url)) return url;

        String path = url.startsWith("/") ? url : "/" + url;
        String base = baseUrl == null ? "" : baseUrl;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    /**
     * Appends query parameters, keeping the order of keys and of each key's values.
     * A key with several values produces repeated entries.
     */
    public static String withQuery(String url, Map<String, ? extends List<String>> params) {
        Objects.requireNonNull(url, "url");
        if (params == null || params.isEmpty()) return url;

        int hash = url.indexOf('#');
        String fragment = hash < 0 ? "" : url.substring(hash);
        String head = hash < 0 ? url : url.substring(0, hash);

        StringBuilder sb = new StringBuilder(head);
        boolean first = head.indexOf('?') < 0;
        for (Map.Entry<String, ? extends List<String>> e : params.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            for (String v : e.getValue()) {
                if (v == null) continue;
                sb.append(first ? '?' : '&');
                first = false;
                sb.append(encode(e.getKey())).append('=').append(encode(v));
            }
        }
        return sb.append(fragment).toString();
    }

    /**
     * Resolves and applies query parameters, requiring an absolute result.
     *
     * @throws IllegalArgumentException if the result is not an absolute http(s) URI
     */
    public static URI toUri(String baseUrl, String url, Map<String, ? extends List<String>> params) {
        String resolved = withQuery(resolve(baseUrl, url), params);
        if (!isAbsolute(resolved)) {
            throw new IllegalArgumentException("Cannot resolve [" + url + "] without an absolute base URL");
        }
        return URI.create(resolved);
    }

    public static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
