package io.safefetch.client;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP client with retries, per-attempt timeouts, cancellation and response hooks.
 *
 * <p>Example usage:
 * <pre>{@code
 * SafeFetchClient client = SafeFetchClient.builder()
 *         .config(ClientConfig.builder().baseUrl("https://api.example.com").build())
 *         .build();
 *
 * User user = client.get("/users/1", User.class);
 * FetchResponse resp = client.call("/health", RequestOptions.builder()
 *         .retries(3)
 *         .timeout(Duration.ofSeconds(2))
 *         .build());
 * }</pre>
 *
 * <p>Responses are returned whatever their status. A 5xx response is retried while attempts
 * remain and returned after the last one. Exceptions are thrown only when no response could be
 * obtained, or when a hook fails.
 */
public interface SafeFetchClient extends AutoCloseable {

    /**
     * Runs one call.
     *
     * @param url absolute URL, or a path resolved against {@link ClientConfig#baseUrl()}
     * @param options the call options, null for {@link RequestOptions#defaults()}
     * @return the final response
     * @throws SafeFetchException if no response could be obtained or a hook failed
     * @throws IllegalArgumentException if {@code url} is relative and no base URL is configured
     * @throws IllegalStateException if the client has been closed
     */
    FetchResponse call(String url, RequestOptions options) throws SafeFetchException;

    /**
     * Runs {@link #call} on the client's executor. The future fails with a
     * {@link java.util.concurrent.CompletionException} wrapping the {@link SafeFetchException}.
     */
    CompletableFuture<FetchResponse> callAsync(String url, RequestOptions options);

    /**
     * Runs a call and decodes its response according to {@link RequestOptions#responseType()}.
     *
     * <ul>
     *   <li>{@code RESPONSE}: the {@link FetchResponse} itself</li>
     *   <li>{@code BYTES}: the body as {@code byte[]}</li>
     *   <li>{@code TEXT}: the body as {@code String}</li>
     *   <li>{@code JSON}: the body read into {@code type}; null for 204 or an empty body; the raw
     *       text when the body is not JSON and {@code type} accepts a String</li>
     * </ul>
     */
    <T> T request(String url, RequestOptions options, Class<T> type) throws SafeFetchException;

    <T> T get(String url, Class<T> type) throws SafeFetchException;

    <T> T get(String url, RequestOptions options, Class<T> type) throws SafeFetchException;

    /**
     * Sends a POST. {@code body} may be a {@link io.safefetch.core.RequestBody} or any value to
     * be sent as JSON. Content-Type defaults to {@code application/json}.
     */
    <T> T post(String url, Object body, Class<T> type) throws SafeFetchException;

    <T> T post(String url, Object body, RequestOptions options, Class<T> type) throws SafeFetchException;

    <T> T put(String url, Object body, Class<T> type) throws SafeFetchException;

    <T> T put(String url, Object body, RequestOptions options, Class<T> type) throws SafeFetchException;

    <T> T patch(String url, Object body, Class<T> type) throws SafeFetchException;

    <T> T patch(String url, Object body, RequestOptions options, Class<T> type) throws SafeFetchException;

    <T> T delete(String url, Class<T> type) throws SafeFetchException;

    <T> T delete(String url, RequestOptions options, Class<T> type) throws SafeFetchException;

    /**
     * Merges {@code update} into the current configuration. Calls already running keep the
     * snapshot they started with.
     */
    void configure(ClientConfig update);

    ClientConfig config();

    /**
     * Cancels every call currently in flight on this client. Calls started afterwards are not
     * affected.
     *
     * @return the number of calls cancelled
     */
    int cancelAll();

    /**
     * Cancels in-flight calls and shuts down the executors this client created. Later calls
     * fail with {@link IllegalStateException}. Closing twice has no further effect.
     */
    @Override
    void close();

    static SafeFetchClient create() {
        return builder().build();
    }

    static SafeFetchClientBuilder builder() {
        return new SafeFetchClientBuilder();
    }
}
