package io.safefetch.http.spi;

import io.safefetch.core.CancellationToken;
import io.safefetch.core.RequestBody;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link HttpTransport} implementation using the JDK 11+ HttpClient.
 * This is the default transport when no other HTTP client library is configured.
 *
 * <p>Requests go through {@link HttpClient#sendAsync}; a fired token cancels the pending future.
 */
public final class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;

    public JdkHttpTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates a new transport with a default HttpClient.
     * @return a new JdkHttpTransport
     */
    public static JdkHttpTransport create() {
        return new JdkHttpTransport(HttpClient.newHttpClient());
    }

    /**
     * Creates a new transport with the specified HttpClient.
     * @param httpClient the HttpClient to use
     * @return a new JdkHttpTransport
     */
    public static JdkHttpTransport create(HttpClient httpClient) {
        return new JdkHttpTransport(httpClient);
    }

    @Override
    public TransportResponse send(TransportRequest request, CancellationToken token) throws TransportException {
        if (token.isCancelled()) {
            throw TransportCancelledException.of(token);
        }

        HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (IllegalArgumentException | IOException e) {
            throw new TransportException("Invalid request: " + e.getMessage(), e);
        }

        CompletableFuture<HttpResponse<byte[]>> future =
                httpClient.sendAsync(jdkRequest, HttpResponse.BodyHandlers.ofByteArray());
        CancellationToken.Registration registration = token.onCancel(reason -> future.cancel(true));
        try {
            HttpResponse<byte[]> response = future.get();
            return new TransportResponse(response.statusCode(), response.headers().map(), response.body());
        } catch (CancellationException e) {
            throw TransportCancelledException.of(token, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof java.net.http.HttpTimeoutException) {
                throw new TransportTimeoutException(cause);
            }
            if (token.isCancelled()) {
                throw TransportCancelledException.of(token, cause);
            }
            throw new TransportException(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportCancelledException(null, e);
        } finally {
            registration.unregister();
        }
    }

    private static HttpRequest toJdkRequest(TransportRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());
        builder.method(request.method(), publisher(request.body()));

        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private static HttpRequest.BodyPublisher publisher(RequestBody body) throws IOException {
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (body instanceof RequestBody.Stream) {
            RequestBody.Stream stream = (RequestBody.Stream) body;
            return HttpRequest.BodyPublishers.ofInputStream(stream.supplier());
        }
        return HttpRequest.BodyPublishers.ofByteArray(BodyEncoder.toBytes(body));
    }
}
