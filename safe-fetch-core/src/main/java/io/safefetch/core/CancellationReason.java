package io.safefetch.core;

import java.util.Objects;

/**
 * Why a {@link CancellationToken} was cancelled.
 *
 * <p>Reasons use identity equality: every firing creates its own instance, and a token derived
 * from several sources (see {@link Signals#anyOf(CancellationToken...)}) reports the very
 * instance of the source that fired. Comparing with {@code ==} tells which source tripped.
 */
public final class CancellationReason {

    private final String message;

    private CancellationReason(String message) {
        this.message = Objects.requireNonNull(message, "message");
    }

    public static CancellationReason of(String message) {
        return new CancellationReason(message);
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return "CancellationReason[" + message + "]";
    }
}
