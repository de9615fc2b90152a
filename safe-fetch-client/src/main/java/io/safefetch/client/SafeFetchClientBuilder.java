package io.safefetch.client;

import io.safefetch.http.spi.HttpTransport;
import io.safefetch.http.spi.JdkHttpTransport;
import io.safefetch.json.spi.JsonCodec;
import io.safefetch.json.spi.JsonCodecProvider;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class SafeFetchClientBuilder {
    private HttpTransport transport;
    private JsonCodec jsonCodec;
    private ScheduledExecutorService scheduler;
    private Executor executor;
    private ClientConfig config = ClientConfig.empty();

    SafeFetchClientBuilder() {}

    public SafeFetchClientBuilder transport(HttpTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public SafeFetchClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    /**
     * Sets the codec for JSON bodies. Without one, the first {@link JsonCodecProvider} found on
     * the class path is used.
     */
    public SafeFetchClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Scheduler for per-attempt timeout timers. Not shut down by {@link SafeFetchClient#close()}.
     */
    public SafeFetchClientBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        return this;
    }

    /**
     * Executor for {@link SafeFetchClient#callAsync}. Not shut down by {@link SafeFetchClient#close()}.
     */
    public SafeFetchClientBuilder executor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        return this;
    }

    public SafeFetchClientBuilder config(ClientConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public SafeFetchClient build() {
        List<ExecutorService> owned = new ArrayList<>();

        HttpTransport resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = new JdkHttpTransport(HttpClient.newHttpClient());
        }
        JsonCodec resolvedCodec = jsonCodec;
        if (resolvedCodec == null) {
            resolvedCodec = JsonCodecProvider.discover().orElse(null);
        }
        ScheduledExecutorService resolvedScheduler = scheduler;
        if (resolvedScheduler == null) {
            resolvedScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("safe-fetch-timer"));
            owned.add(resolvedScheduler);
        }
        Executor resolvedExecutor = executor;
        if (resolvedExecutor == null) {
            ExecutorService pool = Executors.newCachedThreadPool(daemonThreads("safe-fetch-call"));
            owned.add(pool);
            resolvedExecutor = pool;
        }
        return new DefaultSafeFetchClient(resolvedTransport, resolvedCodec, resolvedScheduler,
                resolvedExecutor, owned, config);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
