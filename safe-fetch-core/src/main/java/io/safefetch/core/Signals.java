package io.safefetch.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Combines independent cancellation sources into one effective token.
 */
public final class Signals {
    private Signals() {}

    public static CancellationToken anyOf(CancellationToken... tokens) {
        return anyOf(tokens == null ? List.of() : Arrays.asList(tokens));
    }

    /**
     * Returns a token that is cancelled as soon as any of the given tokens is.
     *
     * <ul>
     *   <li>{@code null} entries are ignored</li>
     *   <li>no tokens: {@link CancellationToken#none()}</li>
     *   <li>one token: that token, unwrapped</li>
     *   <li>several: a linked token; it starts cancelled if an input already is, otherwise it
     *       adopts the reason of the first input to fire and detaches from all inputs</li>
     * </ul>
     *
     * <p>The linked token reports the firing input's reason instance unchanged.
     *
     * @param tokens the sources, possibly containing nulls
     * @return the effective token
     */
    public static CancellationToken anyOf(List<CancellationToken> tokens) {
        List<CancellationToken> active = new ArrayList<>();
        for (CancellationToken t : tokens) {
            if (t != null) active.add(t);
        }

        if (active.isEmpty()) return CancellationToken.none();
        if (active.size() == 1) return active.get(0);

        for (CancellationToken t : active) {
            Optional<CancellationReason> r = t.reason();
            if (r.isPresent()) {
                return new LinkedToken(CancellationController.cancelled(r.get()));
            }
        }

        LinkedToken linked = new LinkedToken(new CancellationController());
        linked.subscribe(active);
        return linked;
    }

    /**
     * Detaches a token produced by {@link #anyOf} from its sources.
     *
     * <p>Call once the work guarded by the token is finished so that long-lived sources do not
     * keep listeners for it. No-op for tokens that were not linked.
     */
    public static void release(CancellationToken token) {
        if (token instanceof LinkedToken) {
            ((LinkedToken) token).detach();
        }
    }

    private static final class LinkedToken implements CancellationToken {
        private final CancellationController controller;
        private final List<Registration> registrations = new ArrayList<>();

        LinkedToken(CancellationController controller) {
            this.controller = controller;
        }

        void subscribe(List<CancellationToken> sources) {
            synchronized (registrations) {
                for (CancellationToken source : sources) {
                    Registration reg = source.onCancel(this::fireFrom);
                    if (controller.isCancelled()) {
                        reg.unregister();
                        break;
                    }
                    registrations.add(reg);
                }
            }
            if (controller.isCancelled()) {
                detach();
            }
        }

        private void fireFrom(CancellationReason reason) {
            if (controller.cancel(reason)) {
                detach();
            }
        }

        void detach() {
            List<Registration> snapshot;
            synchronized (registrations) {
                snapshot = new ArrayList<>(registrations);
                registrations.clear();
            }
            for (Registration reg : snapshot) {
                reg.unregister();
            }
        }

        @Override
        public boolean isCancelled() {
            return controller.isCancelled();
        }

        @Override
        public Optional<CancellationReason> reason() {
            return controller.token().reason();
        }

        @Override
        public Registration onCancel(Consumer<CancellationReason> listener) {
            return controller.token().onCancel(Objects.requireNonNull(listener, "listener"));
        }

        @Override
        public String toString() {
            return "Linked" + controller.token();
        }
    }
}
