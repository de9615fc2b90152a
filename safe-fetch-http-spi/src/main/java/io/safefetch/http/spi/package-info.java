/**
 * Transport boundary for safe-fetch.
 *
 * <p>{@link io.safefetch.http.spi.HttpTransport} sends exactly one request and observes one
 * cancellation token. {@link io.safefetch.http.spi.JdkHttpTransport} is the default; the OkHttp
 * and Apache HttpClient 5 adapters need their client library on the class path.
 */
package io.safefetch.http.spi;
