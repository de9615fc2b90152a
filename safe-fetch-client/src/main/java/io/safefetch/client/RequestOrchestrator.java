package io.safefetch.client;

import io.safefetch.core.CancellationController;
import io.safefetch.core.CancellationToken;
import io.safefetch.core.Headers;
import io.safefetch.core.Urls;
import io.safefetch.http.spi.HttpTransport;
import io.safefetch.http.spi.TransportCancelledException;
import io.safefetch.http.spi.TransportException;
import io.safefetch.http.spi.TransportRequest;
import io.safefetch.http.spi.TransportResponse;
import io.safefetch.http.spi.TransportTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Executes one call end to end: URL resolution, registration, hooks, body preparation, the
 * retry loop and status dispatch.
 *
 * <p>This class is not intended to be used directly by clients.
 */
final class RequestOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestOrchestrator.class);

    private final HttpTransport transport;
    private final BodyNormalizer normalizer;
    private final ScheduledExecutorService scheduler;
    private final ActiveRequests activeRequests;

    RequestOrchestrator(HttpTransport transport, BodyNormalizer normalizer,
                        ScheduledExecutorService scheduler, ActiveRequests activeRequests) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.activeRequests = Objects.requireNonNull(activeRequests, "activeRequests");
    }

    FetchResponse execute(ClientConfig config, String url, RequestOptions options) throws SafeFetchException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(options, "options");

        URI uri = Urls.toUri(config.baseUrl(), url, options.params());
        CancellationController group = activeRequests.register();
        try {
            InterceptorPipeline hooks = new InterceptorPipeline(config);
            RequestOptions merged = options.toBuilder()
                    .headers(Headers.merge(config.headers(), options.headers()))
                    .build();
            RequestOptions effective = hooks.beforeRequest(uri, merged);
            BodyNormalizer.Prepared prepared = normalizer.normalize(effective.headers(), effective.body());
            TransportRequest request = new TransportRequest(effective.method(), uri, prepared.headers(), prepared.body());

            return runAttempts(config, hooks, request, effective, group.token());
        } finally {
            activeRequests.deregister(group);
        }
    }

    private FetchResponse runAttempts(ClientConfig config, InterceptorPipeline hooks, TransportRequest request,
                                      RequestOptions options, CancellationToken group) throws SafeFetchException {
        RetryPolicy policy = RetryPolicy.of(options);
        CancellationToken caller = options.signal();
        AttemptState attempt;
        int index = 0;

        while (true) {
            if (config.debug() && index == 0) {
                LOGGER.info("{} {}", request.method(), request.uri());
            }

            attempt = AttemptState.open(index, caller, group, options.timeout(), scheduler);
            RetryPolicy.Verdict verdict;
            try {
                TransportResponse tr = transport.send(request, attempt.token());
                attempt.recordResponse(new FetchResponse(request.uri(), tr.status(), tr.headers(), tr.body()));
                verdict = policy.onResponse(tr.status(), index);
            } catch (TransportException e) {
                attempt.recordFailure(classify(e, attempt));
                verdict = Thread.currentThread().isInterrupted() ? RetryPolicy.Verdict.GIVE_UP : policy.onFailure(index);
            } finally {
                attempt.close();
            }

            if (attempt.error() != null || verdict == RetryPolicy.Verdict.RETRY) {
                logAttemptFailure(config, attempt, policy);
            }
            if (verdict != RetryPolicy.Verdict.RETRY) {
                break;
            }
            if (!pause(policy.delay())) {
                // interrupted while waiting: surface what the last attempt produced
                break;
            }
            index++;
        }

        FetchResponse response = attempt.response();
        if (response == null) {
            SafeFetchException error = attempt.error();
            logDefinitiveFailure(config, request);
            hooks.networkError(error);
            throw error;
        }

        response = hooks.recover(response, attempt.index());
        hooks.dispatchStatus(response);
        hooks.afterResponse(response);
        return response;
    }

    private static SafeFetchException classify(TransportException e, AttemptState attempt) {
        if (e instanceof TransportCancelledException) {
            TransportCancelledException cancelled = (TransportCancelledException) e;
            AttemptState.Source source = attempt.sourceOf(cancelled.reason()).orElse(null);
            if (source == null) {
                return new NetworkFailureException("Request interrupted", e);
            }
            switch (source) {
                case TIMEOUT:
                    return new RequestTimeoutException(attempt.timeout(), e);
                case CALLER:
                    return new RequestCancelledException(RequestCancelledException.CancelledBy.CALLER, e);
                default:
                    return new RequestCancelledException(RequestCancelledException.CancelledBy.GROUP, e);
            }
        }
        if (e instanceof TransportTimeoutException) {
            return new RequestTimeoutException(null, e);
        }
        return new NetworkFailureException(e.getMessage(), e);
    }

    /**
     * Waits out the fixed retry delay.
     *
     * @return false if the thread was interrupted while waiting
     */
    private static boolean pause(Duration delay) {
        if (delay.isZero()) {
            return true;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(delay.toNanos());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void logAttemptFailure(ClientConfig config, AttemptState attempt, RetryPolicy policy) {
        String message = attempt.error() != null
                ? attempt.error().getMessage()
                : "Server Error " + attempt.response().status();
        if (config.debug()) {
            LOGGER.warn("Attempt {}/{} failed: {} ({}ms)", attempt.index() + 1, policy.maxAttempts(), message,
                    attempt.elapsed().toMillis());
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Attempt {}/{} failed: {} ({}ms)", attempt.index() + 1, policy.maxAttempts(), message,
                    attempt.elapsed().toMillis());
        }
    }

    private static void logDefinitiveFailure(ClientConfig config, TransportRequest request) {
        if (config.debug()) {
            LOGGER.error("Request failed definitively: {} {} headers={}",
                    request.method(), request.uri(), request.headers().keySet());
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Request failed definitively: {} {}", request.method(), request.uri());
        }
    }
}
