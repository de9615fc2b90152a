package io.safefetch.client;

import io.safefetch.core.CancellationController;
import io.safefetch.core.CancellationReason;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of the cancellation controllers of every in-flight call issued by one client.
 *
 * <p>A controller is registered when a call starts and removed when the call returns, on every
 * path. {@link #cancelAll()} reaches calls that are still running, including ones that have not
 * started their first attempt yet.
 */
final class ActiveRequests {

    private final Set<CancellationController> controllers = ConcurrentHashMap.newKeySet();

    CancellationController register() {
        CancellationController controller = new CancellationController();
        controllers.add(controller);
        return controller;
    }

    void deregister(CancellationController controller) {
        controllers.remove(Objects.requireNonNull(controller, "controller"));
    }

    /**
     * Cancels every registered controller and empties the registry.
     *
     * @return the number of calls that were cancelled
     */
    int cancelAll() {
        int cancelled = 0;
        for (CancellationController controller : List.copyOf(controllers)) {
            // a call that finished meanwhile already removed itself
            if (controllers.remove(controller)) {
                controller.cancel(CancellationReason.of(RequestCancelledException.CancelledBy.GROUP.message()));
                cancelled++;
            }
        }
        return cancelled;
    }

    int size() {
        return controllers.size();
    }

    boolean isEmpty() {
        return controllers.isEmpty();
    }
}
