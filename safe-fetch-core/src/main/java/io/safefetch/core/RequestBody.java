package io.safefetch.core;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The shapes a request body can take.
 *
 * <p>The body is resolved once, before the first attempt: structured values may be serialized
 * to JSON and the Content-Type header adjusted, every other shape is sent as provided.
 */
public sealed interface RequestBody
        permits RequestBody.Bytes, RequestBody.Stream, RequestBody.Text,
                RequestBody.Form, RequestBody.UrlEncoded, RequestBody.Structured {

    static Bytes bytes(byte[] data) {
        return new Bytes(data);
    }

    static Stream stream(Supplier<? extends InputStream> supplier) {
        return new Stream(supplier);
    }

    static Text text(String text) {
        return new Text(text);
    }

    static Form form(Map<String, String> fields) {
        return new Form(fields, "----SafeFetchBoundary" + UUID.randomUUID().toString().replace("-", ""));
    }

    static UrlEncoded urlEncoded(Map<String, String> pairs) {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        for (Map.Entry<String, String> e : pairs.entrySet()) {
            entries.add(Map.entry(e.getKey(), e.getValue()));
        }
        return new UrlEncoded(entries);
    }

    static Structured json(Object value) {
        return new Structured(value);
    }

    /**
     * Raw bytes.
     *
     * @param data the payload
     */
    record Bytes(byte[] data) implements RequestBody {
        public Bytes {
            Objects.requireNonNull(data, "data");
        }
    }

    /**
     * A streamed payload. The supplier is invoked once per attempt.
     *
     * @param supplier opens a fresh stream
     */
    record Stream(Supplier<? extends InputStream> supplier) implements RequestBody {
        public Stream {
            Objects.requireNonNull(supplier, "supplier");
        }
    }

    /**
     * A text payload, sent as UTF-8.
     *
     * @param text the payload
     */
    record Text(String text) implements RequestBody {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        public byte[] utf8() {
            return text.getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Multipart form fields.
     *
     * @param fields field name to value, in insertion order
     * @param boundary the multipart boundary
     */
    record Form(Map<String, String> fields, String boundary) implements RequestBody {
        public Form {
            Objects.requireNonNull(boundary, "boundary");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
        }

        public String contentType() {
            return "multipart/form-data; boundary=" + boundary;
        }
    }

    /**
     * URL-encoded name/value pairs. Names may repeat.
     *
     * @param pairs the pairs in send order
     */
    record UrlEncoded(List<Map.Entry<String, String>> pairs) implements RequestBody {
        public UrlEncoded {
            pairs = List.copyOf(Objects.requireNonNull(pairs, "pairs"));
        }
    }

    /**
     * A plain object or collection, serialized to JSON unless a non-JSON Content-Type is set.
     *
     * @param value the value
     */
    record Structured(Object value) implements RequestBody {
        public Structured {
            Objects.requireNonNull(value, "value");
        }
    }
}
