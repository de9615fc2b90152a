package io.safefetch.client;

/**
 * How {@link SafeFetchClient#request(String, RequestOptions, Class)} decodes a response.
 */
public enum ResponseType {
    /** Parse the body as JSON into the requested type; 204 yields null. */
    JSON,
    /** The body as a UTF-8 string (charset from Content-Type when present). */
    TEXT,
    /** The raw body bytes. */
    BYTES,
    /** The {@link FetchResponse} itself, undecoded. */
    RESPONSE
}
