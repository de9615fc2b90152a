package io.safefetch.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-delay retry rules for one call.
 *
 * <p>Attempts are numbered from 0. A call with {@code maxRetries = n} makes at most {@code n + 1}
 * attempts. Responses below 500 end the loop at once; 5xx responses and transport failures are
 * retried while attempts remain. After the last attempt a 5xx response is returned to the caller
 * and a transport failure is thrown.
 */
final class RetryPolicy {

    enum Verdict {
        /** The outcome is final. */
        ACCEPT,
        /** Wait {@link #delay()} and try again. */
        RETRY,
        /** A failure with no attempts left. */
        GIVE_UP
    }

    private final int maxRetries;
    private final Duration delay;

    RetryPolicy(int maxRetries, Duration delay) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.delay = Objects.requireNonNull(delay, "delay");
    }

    static RetryPolicy of(RequestOptions options) {
        return new RetryPolicy(options.retries(), options.retryDelay());
    }

    int maxAttempts() {
        return maxRetries + 1;
    }

    Duration delay() {
        return delay;
    }

    boolean hasAttemptsAfter(int attempt) {
        return attempt < maxRetries;
    }

    Verdict onResponse(int status, int attempt) {
        if (status < 500) {
            return Verdict.ACCEPT;
        }
        return hasAttemptsAfter(attempt) ? Verdict.RETRY : Verdict.ACCEPT;
    }

    Verdict onFailure(int attempt) {
        return hasAttemptsAfter(attempt) ? Verdict.RETRY : Verdict.GIVE_UP;
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxRetries=" + maxRetries + ", delay=" + delay.toMillis() + "ms]";
    }
}
