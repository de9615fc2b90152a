package io.safefetch.client;

/**
 * Connection, DNS or protocol failure before any status code was obtained.
 */
public class NetworkFailureException extends SafeFetchException {

    public NetworkFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
