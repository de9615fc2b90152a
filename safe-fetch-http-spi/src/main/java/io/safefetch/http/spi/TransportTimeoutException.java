package io.safefetch.http.spi;

/**
 * Exception thrown when the underlying HTTP client gives up waiting.
 * Allows callers to distinguish timeout errors from other failures.
 */
public class TransportTimeoutException extends TransportException {

    public TransportTimeoutException(String message) {
        super(message);
    }

    public TransportTimeoutException(Throwable cause) {
        super(cause);
    }
}
