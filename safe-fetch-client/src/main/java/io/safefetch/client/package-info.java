/**
 * The safe-fetch client: {@link io.safefetch.client.SafeFetchClient} and its configuration,
 * options, hooks and exceptions.
 *
 * <p>Each call resolves its URL, registers itself for {@link io.safefetch.client.SafeFetchClient#cancelAll()},
 * runs the pre-request hook, prepares the body once and then loops over attempts. Every attempt
 * observes the caller's token, the client-wide cancellation and its own timeout.
 */
package io.safefetch.client;
