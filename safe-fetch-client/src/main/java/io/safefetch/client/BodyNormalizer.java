package io.safefetch.client;

import io.safefetch.core.Headers;
import io.safefetch.core.RequestBody;
import io.safefetch.json.spi.JsonCodec;
import io.safefetch.json.spi.JsonException;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides, once per call, how the body is sent and which Content-Type goes with it.
 */
final class BodyNormalizer {

    /**
     * Headers and body as every attempt of the call sends them.
     */
    record Prepared(Map<String, String> headers, RequestBody body) {}

    private final JsonCodec codec;

    BodyNormalizer(JsonCodec codec) {
        this.codec = codec;
    }

    Prepared normalize(Map<String, String> headers, RequestBody body) throws SafeFetchException {
        TreeMap<String, String> out = Headers.copyOf(headers);
        RequestBody resolved = body;

        if (body instanceof RequestBody.Form) {
            out.remove(Headers.CONTENT_TYPE);
            out.put(Headers.CONTENT_TYPE, ((RequestBody.Form) body).contentType());
        } else if (body instanceof RequestBody.UrlEncoded) {
            out.putIfAbsent(Headers.CONTENT_TYPE, Headers.FORM_URLENCODED);
        } else if (body instanceof RequestBody.Structured) {
            String contentType = out.get(Headers.CONTENT_TYPE);
            if (contentType == null || contentType.trim().equalsIgnoreCase(Headers.APPLICATION_JSON)) {
                resolved = RequestBody.bytes(serialize(((RequestBody.Structured) body).value()));
                out.putIfAbsent(Headers.CONTENT_TYPE, Headers.APPLICATION_JSON);
            }
        }
        return new Prepared(Collections.unmodifiableMap(out), resolved);
    }

    private byte[] serialize(Object value) throws SafeFetchException {
        if (codec == null) {
            throw new SafeFetchException("No JsonCodec available to serialize a " + value.getClass().getName() + " body");
        }
        try {
            return codec.writeBytes(value);
        } catch (JsonException e) {
            throw new SafeFetchException("Failed to serialize request body: " + e.getMessage(), e);
        }
    }
}
