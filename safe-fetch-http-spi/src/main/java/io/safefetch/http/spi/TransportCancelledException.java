package io.safefetch.http.spi;

import io.safefetch.core.CancellationReason;
import io.safefetch.core.CancellationToken;

/**
 * Exception thrown when the exchange was abandoned because its cancellation token fired.
 */
public class TransportCancelledException extends TransportException {

    private final transient CancellationReason reason;

    public TransportCancelledException(CancellationReason reason) {
        this(reason, null);
    }

    public TransportCancelledException(CancellationReason reason, Throwable cause) {
        super(reason == null ? "Cancelled" : reason.message(), cause);
        this.reason = reason;
    }

    public static TransportCancelledException of(CancellationToken token) {
        return new TransportCancelledException(token.reason().orElse(null));
    }

    public static TransportCancelledException of(CancellationToken token, Throwable cause) {
        return new TransportCancelledException(token.reason().orElse(null), cause);
    }

    /**
     * The reason of the token that fired, or null when the cancellation came from elsewhere
     * (for example a thread interrupt).
     */
    public CancellationReason reason() {
        return reason;
    }
}
