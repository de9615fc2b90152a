package io.safefetch.client;

import java.net.URI;

/**
 * Pre-request hook. Runs once per call, after base URL, query and header merging and before the
 * first attempt. The returned options are used for every attempt of the call.
 *
 * <p>Typical uses: injecting a bearer token, adding dynamic headers.
 */
@FunctionalInterface
public interface RequestInterceptor {

    /**
     * @param url the fully resolved request URL
     * @param options the options after header merging
     * @return the options to send, never null
     * @throws Exception to abort the call with an {@link InterceptorException}
     */
    RequestOptions intercept(URI url, RequestOptions options) throws Exception;
}
