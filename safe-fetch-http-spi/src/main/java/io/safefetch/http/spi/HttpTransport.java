package io.safefetch.http.spi;

import io.safefetch.core.CancellationToken;

/**
 * Performs one network exchange. The retry loop, timeouts and hooks live above this
 * boundary; a transport only sends a request and observes a cancellation token.
 *
 * <p>This interface allows the client to work with different HTTP client libraries
 * (JDK HttpClient, Apache HttpClient, OkHttp, etc.) without a direct dependency on any of them.
 * Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpTransport transport = JdkHttpTransport.create();
 * TransportRequest request = new TransportRequest("GET", URI.create("http://example.com"), Map.of(), null);
 * TransportResponse response = transport.send(request, CancellationToken.none());
 * }</pre>
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Sends a request and reads the full response body.
     *
     * <p>Implementations must watch {@code token} while the exchange is in progress and fail fast
     * with {@link TransportCancelledException} once it fires. A token that is already cancelled
     * must fail the call without any network activity.
     *
     * @param request the request to send
     * @param token cancellation signal for this exchange
     * @return the status, headers and body
     * @throws TransportCancelledException if the token fired
     * @throws TransportTimeoutException if the underlying client timed out
     * @throws TransportException for any other failure before a status was obtained
     */
    TransportResponse send(TransportRequest request, CancellationToken token) throws TransportException;
}
