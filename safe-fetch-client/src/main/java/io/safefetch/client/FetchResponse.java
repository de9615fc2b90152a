package io.safefetch.client;

import io.safefetch.core.Headers;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The final response of a call: status, headers and the fully read body.
 *
 * <p>Hooks may build their own instance, for example to replace a 401 with the result of a
 * request retried after refreshing credentials.
 */
public final class FetchResponse {

    private final URI uri;
    private final int status;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public FetchResponse(URI uri, int status, Map<String, ? extends List<String>> headers, byte[] body) {
        this.uri = uri;
        this.status = status;
        this.headers = copyHeaders(headers);
        this.body = body == null ? new byte[0] : body;
    }

    public static FetchResponse of(int status, String body) {
        return new FetchResponse(null, status, Map.of(), body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * The URI the response was received from, or null for responses built by hooks.
     */
    public URI uri() {
        return uri;
    }

    public int status() {
        return status;
    }

    /**
     * Returns true for 2xx statuses.
     */
    public boolean ok() {
        return status >= 200 && status < 300;
    }

    /**
     * Headers keyed case-insensitively.
     */
    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }

    public byte[] bytes() {
        return body.clone();
    }

    public String text() {
        return new String(body, charset());
    }

    boolean hasBody() {
        return body.length > 0;
    }

    byte[] rawBody() {
        return body;
    }

    private Charset charset() {
        String contentType = header(Headers.CONTENT_TYPE).orElse(null);
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                String p = part.trim();
                if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                    try {
                        return Charset.forName(p.substring("charset=".length()).replace("\"", ""));
                    } catch (IllegalArgumentException e) {
                        return StandardCharsets.UTF_8;
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static Map<String, List<String>> copyHeaders(Map<String, ? extends List<String>> headers) {
        TreeMap<String, List<String>> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            for (Map.Entry<String, ? extends List<String>> e : headers.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                out.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).addAll(e.getValue());
            }
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public String toString() {
        return "FetchResponse[" + status + (uri == null ? "" : " " + uri) + "]";
    }
}
