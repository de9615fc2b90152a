package io.safefetch.client;

/**
 * Observes a final response: used for status-code handlers, the generic server-error handler
 * and the post-response hook.
 */
@FunctionalInterface
public interface ResponseHandler {

    void handle(FetchResponse response) throws Exception;
}
