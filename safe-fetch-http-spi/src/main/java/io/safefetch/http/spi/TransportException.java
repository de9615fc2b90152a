package io.safefetch.http.spi;

/**
 * Exception thrown when an exchange fails before a status code is obtained.
 * Wraps underlying implementation-specific exceptions.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public TransportException(Throwable cause) {
        super(cause);
    }
}
