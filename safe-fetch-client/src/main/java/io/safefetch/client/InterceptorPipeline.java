package io.safefetch.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Runs the hooks of one configuration snapshot in their fixed order.
 *
 * <p>Any exception thrown by a hook is wrapped in an {@link InterceptorException} and aborts
 * the call, except for the network-error hook: its failure is logged and attached as a
 * suppressed exception to the error that is being surfaced anyway.
 */
final class InterceptorPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(InterceptorPipeline.class);

    private final ClientConfig config;

    InterceptorPipeline(ClientConfig config) {
        this.config = config;
    }

    RequestOptions beforeRequest(URI uri, RequestOptions options) throws InterceptorException {
        RequestInterceptor hook = config.onRequest();
        if (hook == null) {
            return options;
        }
        RequestOptions replaced;
        try {
            replaced = hook.intercept(uri, options);
        } catch (Exception e) {
            throw new InterceptorException("onRequest", e);
        }
        return replaced == null ? options : replaced;
    }

    /**
     * Gives the recoverable-error hook a chance to substitute a non-ok response below 500.
     */
    FetchResponse recover(FetchResponse response, int attempt) throws InterceptorException {
        ResponseErrorInterceptor hook = config.onResponseError();
        if (hook == null || response.ok() || response.status() >= 500) {
            return response;
        }
        FetchResponse substitute;
        try {
            substitute = hook.recover(response, attempt);
        } catch (Exception e) {
            throw new InterceptorException("onResponseError", e);
        }
        if (substitute != null && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Response {} replaced by {}", response.status(), substitute.status());
        }
        return substitute == null ? response : substitute;
    }

    void dispatchStatus(FetchResponse response) throws InterceptorException {
        int status = response.status();
        ResponseHandler exact = config.statusHandler(status);
        if (exact != null) {
            run("on" + status, exact, response);
        }
        ResponseHandler serverError = config.onServerError();
        if (serverError != null && status >= 500 && status != 500) {
            run("onServerError", serverError, response);
        }
    }

    void afterResponse(FetchResponse response) throws InterceptorException {
        ResponseHandler hook = config.onResponse();
        if (hook != null) {
            run("onResponse", hook, response);
        }
    }

    void networkError(SafeFetchException error) {
        ErrorHandler hook = config.onError();
        if (hook == null) {
            return;
        }
        try {
            hook.onError(error);
        } catch (Exception e) {
            LOGGER.warn("onError hook failed: {}", e.getMessage(), e);
            error.addSuppressed(e);
        }
    }

    private static void run(String name, ResponseHandler handler, FetchResponse response) throws InterceptorException {
        try {
            handler.handle(response);
        } catch (Exception e) {
            throw new InterceptorException(name, e);
        }
    }
}
