package io.safefetch.client;

import java.util.Objects;

/**
 * The call was cancelled before a response arrived.
 */
public class RequestCancelledException extends SafeFetchException {

    /**
     * Which source cancelled the call.
     */
    public enum CancelledBy {
        /** The token passed in {@link RequestOptions#signal()}. */
        CALLER("Request aborted by user"),
        /** {@link SafeFetchClient#cancelAll()} on the issuing client. */
        GROUP("Request aborted by abortAll()");

        private final String message;

        CancelledBy(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final CancelledBy cancelledBy;

    public RequestCancelledException(CancelledBy cancelledBy, Throwable cause) {
        super(Objects.requireNonNull(cancelledBy, "cancelledBy").message(), cause);
        this.cancelledBy = cancelledBy;
    }

    public CancelledBy cancelledBy() {
        return cancelledBy;
    }
}
