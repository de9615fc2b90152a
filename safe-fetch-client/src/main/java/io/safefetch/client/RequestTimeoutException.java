package io.safefetch.client;

import java.time.Duration;

/**
 * The per-attempt timeout fired before a response arrived.
 */
public class RequestTimeoutException extends SafeFetchException {

    private final Duration timeout;

    public RequestTimeoutException(Duration timeout, Throwable cause) {
        super(message(timeout), cause);
        this.timeout = timeout;
    }

    /**
     * The configured timeout, or null when the transport itself timed out.
     */
    public Duration timeout() {
        return timeout;
    }

    private static String message(Duration timeout) {
        return timeout == null ? "Request timeout" : "Request timeout after " + timeout.toMillis() + "ms";
    }
}
