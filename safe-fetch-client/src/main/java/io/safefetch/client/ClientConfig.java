package io.safefetch.client;

import io.safefetch.core.Headers;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Instance-level configuration: base URL, default headers, debug flag and hooks.
 *
 * <p>Instances are immutable. A client holds one current snapshot and replaces it through
 * {@link SafeFetchClient#configure(ClientConfig)}, which {@linkplain #merge merges} the update
 * into it. Every unset field of an update leaves the current value alone.
 */
public final class ClientConfig {

    private static final ClientConfig EMPTY = builder().build();

    private final String baseUrl;
    private final Map<String, String> headers;
    private final Boolean debug;
    private final RequestInterceptor onRequest;
    private final ResponseHandler onResponse;
    private final ResponseErrorInterceptor onResponseError;
    private final Map<Integer, ResponseHandler> statusHandlers;
    private final ResponseHandler onServerError;
    private final ErrorHandler onError;

    private ClientConfig(Builder b) {
        this.baseUrl = b.baseUrl;
        this.headers = Collections.unmodifiableMap(Headers.copyOf(b.headers));
        this.debug = b.debug;
        this.onRequest = b.onRequest;
        this.onResponse = b.onResponse;
        this.onResponseError = b.onResponseError;
        this.statusHandlers = Collections.unmodifiableMap(new LinkedHashMap<>(b.statusHandlers));
        this.onServerError = b.onServerError;
        this.onError = b.onError;
    }

    public static ClientConfig empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a new snapshot with {@code update} applied on top of this one.
     *
     * <ul>
     *   <li>headers merge name by name (case-insensitive), the update winning</li>
     *   <li>status handlers merge code by code</li>
     *   <li>every other field is replaced when set in the update</li>
     * </ul>
     */
    public ClientConfig merge(ClientConfig update) {
        Objects.requireNonNull(update, "update");
        Builder b = new Builder();
        b.baseUrl = update.baseUrl != null ? update.baseUrl : baseUrl;
        b.headers.putAll(Headers.merge(headers, update.headers));
        b.debug = update.debug != null ? update.debug : debug;
        b.onRequest = update.onRequest != null ? update.onRequest : onRequest;
        b.onResponse = update.onResponse != null ? update.onResponse : onResponse;
        b.onResponseError = update.onResponseError != null ? update.onResponseError : onResponseError;
        b.statusHandlers.putAll(statusHandlers);
        b.statusHandlers.putAll(update.statusHandlers);
        b.onServerError = update.onServerError != null ? update.onServerError : onServerError;
        b.onError = update.onError != null ? update.onError : onError;
        return b.build();
    }

    /**
     * Base URL prefixed to relative request URLs, or null.
     */
    public String baseUrl() { return baseUrl; }

    public Map<String, String> headers() { return headers; }

    public boolean debug() { return Boolean.TRUE.equals(debug); }

    public RequestInterceptor onRequest() { return onRequest; }

    public ResponseHandler onResponse() { return onResponse; }

    public ResponseErrorInterceptor onResponseError() { return onResponseError; }

    public Map<Integer, ResponseHandler> statusHandlers() { return statusHandlers; }

    public ResponseHandler statusHandler(int status) { return statusHandlers.get(status); }

    /**
     * Handler for every status &gt;= 500 except 500 itself.
     */
    public ResponseHandler onServerError() { return onServerError; }

    public ErrorHandler onError() { return onError; }

    public static final class Builder {
        private String baseUrl;
        private final TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private Boolean debug;
        private RequestInterceptor onRequest;
        private ResponseHandler onResponse;
        private ResponseErrorInterceptor onResponseError;
        private final Map<Integer, ResponseHandler> statusHandlers = new LinkedHashMap<>();
        private ResponseHandler onServerError;
        private ErrorHandler onError;

        private Builder() {}

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder onRequest(RequestInterceptor onRequest) {
            this.onRequest = onRequest;
            return this;
        }

        public Builder onResponse(ResponseHandler onResponse) {
            this.onResponse = onResponse;
            return this;
        }

        public Builder onResponseError(ResponseErrorInterceptor onResponseError) {
            this.onResponseError = onResponseError;
            return this;
        }

        /**
         * Registers a handler for one exact status code.
         */
        public Builder onStatus(int status, ResponseHandler handler) {
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("Not an HTTP status code: " + status);
            }
            statusHandlers.put(status, Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder onServerError(ResponseHandler onServerError) {
            this.onServerError = onServerError;
            return this;
        }

        public Builder onError(ErrorHandler onError) {
            this.onError = onError;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
