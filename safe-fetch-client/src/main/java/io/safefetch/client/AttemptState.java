package io.safefetch.client;

import io.safefetch.core.CancellationController;
import io.safefetch.core.CancellationReason;
import io.safefetch.core.CancellationToken;
import io.safefetch.core.Signals;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One attempt of a call: its index, start time, cancellation sources and outcome.
 *
 * <p>Combines the caller's token, the call's group token and, when a timeout is set, a fresh
 * timeout token whose timer starts when the attempt is opened. Closing the state cancels the
 * timer and detaches the combined token from the long-lived sources. The outcome is either a
 * response or a classified failure, never both.
 */
final class AttemptState implements AutoCloseable {

    private final int index;
    private final Instant startedAt;
    private final CancellationToken caller;
    private final CancellationToken group;
    private final Duration timeout;
    private final CancellationController timeoutController;
    private final CancellationReason timeoutReason;
    private final ScheduledFuture<?> timer;
    private final CancellationToken effective;

    private FetchResponse response;
    private SafeFetchException error;

    private AttemptState(int index, CancellationToken caller, CancellationToken group, Duration timeout,
                         ScheduledExecutorService scheduler) throws SafeFetchException {
        this.index = index;
        this.startedAt = Instant.now();
        this.caller = caller;
        this.group = group;
        this.timeout = timeout;
        if (timeout != null) {
            this.timeoutController = new CancellationController();
            this.timeoutReason = CancellationReason.of("Request timeout after " + timeout.toMillis() + "ms");
            try {
                this.timer = scheduler.schedule(() -> timeoutController.cancel(timeoutReason),
                        timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                throw new SafeFetchException("Cannot schedule request timeout: scheduler is shut down", e);
            }
            this.effective = Signals.anyOf(caller, group, timeoutController.token());
        } else {
            this.timeoutController = null;
            this.timeoutReason = null;
            this.timer = null;
            this.effective = Signals.anyOf(caller, group);
        }
    }

    static AttemptState open(int index, CancellationToken caller, CancellationToken group, Duration timeout,
                             ScheduledExecutorService scheduler) throws SafeFetchException {
        return new AttemptState(index, caller, group, timeout, scheduler);
    }

    /**
     * Zero-based position of this attempt within the call.
     */
    int index() {
        return index;
    }

    Instant startedAt() {
        return startedAt;
    }

    Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }

    /**
     * The token handed to the transport.
     */
    CancellationToken token() {
        return effective;
    }

    Duration timeout() {
        return timeout;
    }

    void recordResponse(FetchResponse response) {
        this.response = response;
        this.error = null;
    }

    void recordFailure(SafeFetchException error) {
        this.error = error;
        this.response = null;
    }

    /**
     * The response this attempt obtained, or null if it failed.
     */
    FetchResponse response() {
        return response;
    }

    /**
     * The classified failure of this attempt, or null if it obtained a response.
     */
    SafeFetchException error() {
        return error;
    }

    /**
     * Maps a cancellation reason back to the source that produced it. Reasons are matched by
     * identity first; a reason that matches no source (or none at all, as for an interrupt)
     * falls back to whichever source has fired, timeout first.
     */
    Optional<Source> sourceOf(CancellationReason reason) {
        if (reason != null) {
            if (reason == timeoutReason) return Optional.of(Source.TIMEOUT);
            if (caller != null && reason == caller.reason().orElse(null)) return Optional.of(Source.CALLER);
            if (reason == group.reason().orElse(null)) return Optional.of(Source.GROUP);
        }
        if (timeoutController != null && timeoutController.isCancelled()) return Optional.of(Source.TIMEOUT);
        if (caller != null && caller.isCancelled()) return Optional.of(Source.CALLER);
        if (group.isCancelled()) return Optional.of(Source.GROUP);
        return Optional.empty();
    }

    @Override
    public void close() {
        if (timer != null) {
            timer.cancel(false);
        }
        Signals.release(effective);
    }

    @Override
    public String toString() {
        return "AttemptState[" + index + (response != null ? ", status=" + response.status() : "")
                + (error != null ? ", error=" + error.getMessage() : "") + "]";
    }

    enum Source {
        TIMEOUT,
        CALLER,
        GROUP
    }
}
