package io.safefetch.client;

import io.safefetch.core.Headers;
import io.safefetch.core.RequestBody;
import io.safefetch.http.spi.HttpTransport;
import io.safefetch.json.spi.JsonCodec;
import io.safefetch.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

final class DefaultSafeFetchClient implements SafeFetchClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultSafeFetchClient.class);

    private final RequestOrchestrator orchestrator;
    private final ActiveRequests activeRequests;
    private final JsonCodec codec;
    private final Executor executor;
    private final List<ExecutorService> owned;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile ClientConfig config;

    DefaultSafeFetchClient(HttpTransport transport, JsonCodec codec, ScheduledExecutorService scheduler,
                           Executor executor, List<ExecutorService> owned, ClientConfig config) {
        this.activeRequests = new ActiveRequests();
        this.orchestrator = new RequestOrchestrator(transport, new BodyNormalizer(codec), scheduler, activeRequests);
        this.codec = codec;
        this.executor = Objects.requireNonNull(executor, "executor");
        this.owned = List.copyOf(owned);
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public FetchResponse call(String url, RequestOptions options) throws SafeFetchException {
        ensureOpen();
        return orchestrator.execute(config, url, options == null ? RequestOptions.defaults() : options);
    }

    @Override
    public CompletableFuture<FetchResponse> callAsync(String url, RequestOptions options) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(closedException());
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call(url, options);
            } catch (SafeFetchException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    @Override
    public <T> T request(String url, RequestOptions options, Class<T> type) throws SafeFetchException {
        Objects.requireNonNull(type, "type");
        RequestOptions opts = options == null ? RequestOptions.defaults() : options;
        FetchResponse response = call(url, opts);

        switch (opts.responseType()) {
            case RESPONSE:
                return as(response, type);
            case BYTES:
                return as(response.bytes(), type);
            case TEXT:
                return as(response.text(), type);
            default:
                return decodeJson(response, type);
        }
    }

    private <T> T decodeJson(FetchResponse response, Class<T> type) throws SafeFetchException {
        if (response.status() == 204 || !response.hasBody()) {
            return null;
        }
        if (type == FetchResponse.class) {
            return type.cast(response);
        }
        if (codec == null) {
            if (type.isAssignableFrom(String.class)) {
                return type.cast(response.text());
            }
            throw new SafeFetchException("No JsonCodec available to decode the response of " + response.uri());
        }
        try {
            return codec.readValue(response.rawBody(), type);
        } catch (JsonException e) {
            if (type.isAssignableFrom(String.class)) {
                return type.cast(response.text());
            }
            throw new SafeFetchException("Failed to decode response body as " + type.getName() + ": " + e.getMessage(), e);
        }
    }

    private static <T> T as(Object value, Class<T> type) throws SafeFetchException {
        if (!type.isInstance(value)) {
            throw new SafeFetchException("Cannot return " + value.getClass().getSimpleName() + " as " + type.getName());
        }
        return type.cast(value);
    }

    @Override
    public <T> T get(String url, Class<T> type) throws SafeFetchException {
        return get(url, null, type);
    }

    @Override
    public <T> T get(String url, RequestOptions options, Class<T> type) throws SafeFetchException {
        return request(url, withMethod(options, "GET"), type);
    }

    @Override
    public <T> T post(String url, Object body, Class<T> type) throws SafeFetchException {
        return post(url, body, null, type);
    }

    @Override
    public <T> T post(String url, Object body, RequestOptions options, Class<T> type) throws SafeFetchException {
        return request(url, withBody(options, "POST", body), type);
    }

    @Override
    public <T> T put(String url, Object body, Class<T> type) throws SafeFetchException {
        return put(url, body, null, type);
    }

    @Override
    public <T> T put(String url, Object body, RequestOptions options, Class<T> type) throws SafeFetchException {
        return request(url, withBody(options, "PUT", body), type);
    }

    @Override
    public <T> T patch(String url, Object body, Class<T> type) throws SafeFetchException {
        return patch(url, body, null, type);
    }

    @Override
    public <T> T patch(String url, Object body, RequestOptions options, Class<T> type) throws SafeFetchException {
        return request(url, withBody(options, "PATCH", body), type);
    }

    @Override
    public <T> T delete(String url, Class<T> type) throws SafeFetchException {
        return delete(url, null, type);
    }

    @Override
    public <T> T delete(String url, RequestOptions options, Class<T> type) throws SafeFetchException {
        return request(url, withMethod(options, "DELETE"), type);
    }

    private static RequestOptions withMethod(RequestOptions options, String method) {
        RequestOptions base = options == null ? RequestOptions.defaults() : options;
        return base.toBuilder().method(method).build();
    }

    private static RequestOptions withBody(RequestOptions options, String method, Object body) {
        RequestOptions base = options == null ? RequestOptions.defaults() : options;
        RequestOptions.Builder b = base.toBuilder().method(method).body(toBody(body));
        if (!base.headers().containsKey(Headers.CONTENT_TYPE)) {
            b.header(Headers.CONTENT_TYPE, Headers.APPLICATION_JSON);
        }
        return b.build();
    }

    private static RequestBody toBody(Object body) {
        if (body == null) return null;
        if (body instanceof RequestBody) return (RequestBody) body;
        if (body instanceof String) return RequestBody.text((String) body);
        if (body instanceof byte[]) return RequestBody.bytes((byte[]) body);
        return RequestBody.json(body);
    }

    @Override
    public synchronized void configure(ClientConfig update) {
        config = config.merge(update);
    }

    @Override
    public ClientConfig config() {
        return config;
    }

    @Override
    public int cancelAll() {
        int cancelled = activeRequests.cancelAll();
        if (cancelled > 0 && config.debug()) {
            LOGGER.info("Cancelled {} in-flight request(s)", cancelled);
        }
        return cancelled;
    }

    int inFlight() {
        return activeRequests.size();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw closedException();
        }
    }

    private static IllegalStateException closedException() {
        return new IllegalStateException("SafeFetchClient is closed");
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cancelAll();
        for (ExecutorService service : owned) {
            service.shutdownNow();
        }
    }
}
