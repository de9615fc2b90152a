package io.safefetch.client;

/**
 * A user-supplied hook threw. The call is aborted with this exception.
 */
public class InterceptorException extends SafeFetchException {

    public InterceptorException(String hook, Throwable cause) {
        super(hook + " hook failed: " + cause.getMessage(), cause);
    }
}
