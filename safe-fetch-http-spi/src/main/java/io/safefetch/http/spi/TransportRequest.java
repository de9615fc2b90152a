package io.safefetch.http.spi;

import io.safefetch.core.RequestBody;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * A fully prepared request: the URL is resolved, headers are final and the body shape is decided.
 *
 * @param method HTTP method
 * @param uri absolute target
 * @param headers header names to values, names unique ignoring case
 * @param body the body, or null
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, RequestBody body) {
    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String header(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }
}
