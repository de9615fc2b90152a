package io.safefetch.client;

/**
 * Recovery hook for non-2xx responses below 500.
 *
 * <p>Returning a response replaces the one handed to the caller. The orchestrator does not
 * re-enter its retry loop afterwards: issuing any follow-up request (for example after a token
 * refresh) is the hook's own business.
 */
@FunctionalInterface
public interface ResponseErrorInterceptor {

    /**
     * @param response the response that was not ok
     * @param attempt zero-based index of the attempt that produced it
     * @return a substitute response, or null to keep {@code response}
     */
    FetchResponse recover(FetchResponse response, int attempt) throws Exception;
}
