package io.safefetch.client;

/**
 * Network-error hook. Observes the classified failure of a call that produced no response;
 * the failure is still thrown to the caller afterwards.
 */
@FunctionalInterface
public interface ErrorHandler {

    void onError(SafeFetchException error) throws Exception;
}
