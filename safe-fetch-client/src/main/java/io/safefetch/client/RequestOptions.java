package io.safefetch.client;

import io.safefetch.core.CancellationToken;
import io.safefetch.core.Headers;
import io.safefetch.core.RequestBody;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Describes one call: method, headers, body, query parameters and resilience settings.
 * This is an immutable value type with a fluent builder API.
 *
 * <p>The pre-request hook may return a modified copy (see {@link #toBuilder()}); the copy is
 * then used for every attempt of the call.
 */
public final class RequestOptions {

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(1000);

    private static final RequestOptions DEFAULTS = builder().build();

    private final String method;
    private final Map<String, String> headers;
    private final RequestBody body;
    private final Map<String, List<String>> params;
    private final Duration timeout;
    private final int retries;
    private final Duration retryDelay;
    private final ResponseType responseType;
    private final CancellationToken signal;

    private RequestOptions(Builder b) {
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(Headers.copyOf(b.headers));
        this.body = b.body;
        LinkedHashMap<String, List<String>> p = new LinkedHashMap<>();
        b.params.forEach((k, v) -> p.put(k, List.copyOf(v)));
        this.params = Collections.unmodifiableMap(p);
        this.timeout = b.timeout;
        this.retries = b.retries;
        this.retryDelay = b.retryDelay;
        this.responseType = b.responseType;
        this.signal = b.signal;
    }

    public static RequestOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.method = method;
        b.headers.putAll(headers);
        b.body = body;
        params.forEach((k, v) -> b.params.put(k, new ArrayList<>(v)));
        b.timeout = timeout;
        b.retries = retries;
        b.retryDelay = retryDelay;
        b.responseType = responseType;
        b.signal = signal;
        return b;
    }

    public String method() { return method; }

    /**
     * Headers keyed case-insensitively.
     */
    public Map<String, String> headers() { return headers; }

    public RequestBody body() { return body; }

    /**
     * Query parameters in insertion order; each key maps to one or more values.
     */
    public Map<String, List<String>> params() { return params; }

    /**
     * Per-attempt timeout, or null for none.
     */
    public Duration timeout() { return timeout; }

    /**
     * Additional attempts after the first one.
     */
    public int retries() { return retries; }

    public Duration retryDelay() { return retryDelay; }

    public ResponseType responseType() { return responseType; }

    /**
     * The caller's cancellation token, or null.
     */
    public CancellationToken signal() { return signal; }

    @Override
    public String toString() {
        return "RequestOptions[" + method + ", retries=" + retries + ", timeout=" + timeout + "]";
    }

    public static final class Builder {
        private String method = "GET";
        private final TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private RequestBody body;
        private final LinkedHashMap<String, List<String>> params = new LinkedHashMap<>();
        private Duration timeout;
        private int retries;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private ResponseType responseType = ResponseType.JSON;
        private CancellationToken signal;

        private Builder() {}

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            headers.remove(name);
            if (value != null) headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder removeHeader(String name) {
            headers.remove(name);
            return this;
        }

        public Builder body(RequestBody body) {
            this.body = body;
            return this;
        }

        /**
         * Adds a scalar query parameter. A null value leaves the key out.
         */
        public Builder param(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (value != null) {
                params.computeIfAbsent(key, k -> new ArrayList<>()).add(String.valueOf(value));
            }
            return this;
        }

        /**
         * Adds a list-valued query parameter, sent as repeated entries in iteration order.
         */
        public Builder param(String key, Iterable<?> values) {
            Objects.requireNonNull(key, "key");
            if (values != null) {
                for (Object v : values) {
                    param(key, v);
                }
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder retries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("retries must not be negative: " + retries);
            }
            this.retries = retries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
            }
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder responseType(ResponseType responseType) {
            this.responseType = Objects.requireNonNull(responseType, "responseType");
            return this;
        }

        public Builder signal(CancellationToken signal) {
            this.signal = signal;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
