package io.safefetch.core;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * A one-shot cancellation signal.
 *
 * <p>A token starts in the "not cancelled" state and may transition exactly once to
 * "cancelled", at which point it carries a {@link CancellationReason}. Tokens are
 * observed, never fired: firing is done through the owning {@link CancellationController}.
 *
 * <p>Implementations must be thread-safe. Listeners run on the thread that fires the token,
 * or on the registering thread when the token was already cancelled at registration time.
 */
public interface CancellationToken {

    /**
     * Returns whether this token has been cancelled.
     * @return true once cancelled
     */
    boolean isCancelled();

    /**
     * Returns the reason this token was cancelled with.
     * @return the reason, or empty while not cancelled
     */
    Optional<CancellationReason> reason();

    /**
     * Registers a listener invoked once when this token is cancelled.
     *
     * <p>If the token is already cancelled the listener runs immediately on the calling thread.
     *
     * @param listener receives the cancellation reason
     * @return a registration that detaches the listener
     */
    Registration onCancel(Consumer<CancellationReason> listener);

    /**
     * Returns a token that can never be cancelled.
     * @return the shared no-op token
     */
    static CancellationToken none() {
        return NoneToken.INSTANCE;
    }

    /**
     * Handle for a listener registered through {@link #onCancel(Consumer)}.
     */
    interface Registration {

        /**
         * Detaches the listener. Safe to call more than once, and after the listener fired.
         */
        void unregister();

        static Registration noop() {
            return () -> { };
        }
    }

    final class NoneToken implements CancellationToken {
        private static final NoneToken INSTANCE = new NoneToken();

        private NoneToken() {}

        @Override public boolean isCancelled() { return false; }
        @Override public Optional<CancellationReason> reason() { return Optional.empty(); }
        @Override public Registration onCancel(Consumer<CancellationReason> listener) { return Registration.noop(); }
        @Override public String toString() { return "CancellationToken.none()"; }
    }
}
