package io.safefetch.client;

/**
 * Base class for failures surfaced by a {@link SafeFetchClient} call.
 *
 * <p>A call that obtained a response never fails with a status-based exception: 4xx and
 * (after retries) 5xx responses are returned to the caller. Subclasses describe why no
 * response could be produced.
 */
public class SafeFetchException extends Exception {

    public SafeFetchException(String message) {
        super(message);
    }

    public SafeFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
