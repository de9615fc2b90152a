package io.safefetch.client;

/**
 * Access to the process-wide default client.
 *
 * <p>The instance is built on first use with default settings and lives for the rest of the
 * process. Adjust it through {@link SafeFetchClient#configure(ClientConfig)}.
 */
public final class SafeFetch {
    private SafeFetch() {}

    public static SafeFetchClient defaultClient() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        static final SafeFetchClient INSTANCE = SafeFetchClient.builder().build();
    }
}
