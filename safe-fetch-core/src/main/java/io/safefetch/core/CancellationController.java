package io.safefetch.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owner side of a {@link CancellationToken}.
 *
 * <p>Example usage:
 * <pre>{@code
 * CancellationController controller = new CancellationController();
 * client.call("/users", RequestOptions.builder().signal(controller.token()).build());
 * // elsewhere
 * controller.cancel();
 * }</pre>
 */
public final class CancellationController {

    static final String DEFAULT_MESSAGE = "Cancelled";

    private final Token token = new Token();

    public CancellationToken token() {
        return token;
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * Cancels the token with a default reason.
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        return cancel(CancellationReason.of(DEFAULT_MESSAGE));
    }

    public boolean cancel(String message) {
        return cancel(CancellationReason.of(message));
    }

    /**
     * Cancels the token. Only the first call has an effect; its reason is kept.
     * @param reason the reason reported by the token
     * @return true if this call cancelled the token
     */
    public boolean cancel(CancellationReason reason) {
        return token.fire(Objects.requireNonNull(reason, "reason"));
    }

    /**
     * Creates a controller whose token is already cancelled.
     */
    public static CancellationController cancelled(CancellationReason reason) {
        CancellationController controller = new CancellationController();
        controller.cancel(reason);
        return controller;
    }

    private static final class Token implements CancellationToken {
        private final AtomicReference<CancellationReason> reason = new AtomicReference<>();
        private final List<Listener> listeners = new CopyOnWriteArrayList<>();

        @Override
        public boolean isCancelled() {
            return reason.get() != null;
        }

        @Override
        public Optional<CancellationReason> reason() {
            return Optional.ofNullable(reason.get());
        }

        @Override
        public Registration onCancel(Consumer<CancellationReason> callback) {
            Objects.requireNonNull(callback, "callback");
            Listener listener = new Listener(callback);
            listeners.add(listener);

            // Fired between the add and this check: deliver here, fire() may have missed us.
            CancellationReason current = reason.get();
            if (current != null) {
                listeners.remove(listener);
                listener.deliver(current);
                return Registration.noop();
            }
            return () -> listeners.remove(listener);
        }

        boolean fire(CancellationReason r) {
            if (!reason.compareAndSet(null, r)) {
                return false;
            }
            for (Listener listener : listeners) {
                listener.deliver(r);
            }
            listeners.clear();
            return true;
        }

        @Override
        public String toString() {
            CancellationReason r = reason.get();
            return r == null ? "CancellationToken[active]" : "CancellationToken[cancelled: " + r.message() + "]";
        }
    }

    private static final class Listener {
        private final Consumer<CancellationReason> callback;
        private final AtomicBoolean delivered = new AtomicBoolean();

        Listener(Consumer<CancellationReason> callback) {
            this.callback = callback;
        }

        void deliver(CancellationReason r) {
            if (delivered.compareAndSet(false, true)) {
                callback.accept(r);
            }
        }
    }
}
