/**
 * Transport-neutral building blocks for safe-fetch.
 *
 * <p>This module has no third-party dependencies. It contains:
 * <ul>
 *   <li>Cancellation tokens, their controllers, and {@link io.safefetch.core.Signals} to merge them</li>
 *   <li>The closed set of request body shapes</li>
 *   <li>Lightweight utilities (URL resolution, ordered query strings, case-insensitive headers)</li>
 * </ul>
 *
 * <p>The retry loop and hook pipeline live in the client module.
 */
package io.safefetch.core;
