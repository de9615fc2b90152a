package io.safefetch.client;

import io.safefetch.core.CancellationController;
import io.safefetch.core.RequestBody;
import io.safefetch.http.spi.TransportRequest;
import io.safefetch.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.safefetch.client.ScriptedTransport.fail;
import static io.safefetch.client.ScriptedTransport.hang;
import static io.safefetch.client.ScriptedTransport.respond;
import static io.safefetch.client.ScriptedTransport.timeOut;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RequestOrchestratorTest {

    private static final String URL = "http://api.test/items";

    private ScriptedTransport transport;
    private SafeFetchClient client;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        client = client(ClientConfig.empty());
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private SafeFetchClient client(ClientConfig config) {
        return SafeFetchClient.builder()
                .transport(transport)
                .jsonCodec(new JacksonJsonCodec())
                .config(config)
                .build();
    }

    private static RequestOptions retrying(int retries, long delayMillis) {
        return RequestOptions.builder()
                .retries(retries)
                .retryDelay(Duration.ofMillis(delayMillis))
                .build();
    }

    private int inFlight() {
        return ((DefaultSafeFetchClient) client).inFlight();
    }

    @Test
    void withoutRetriesMakesSingleAttempt() {
        transport.always(fail("connection refused"));

        assertThatThrownBy(() -> client.call(URL, null))
                .isInstanceOf(NetworkFailureException.class)
                .hasMessage("connection refused");
        assertThat(transport.attempts()).isEqualTo(1);
    }

    @Test
    void withoutRetriesServerErrorIsReturnedAfterOneAttempt() throws Exception {
        transport.always(respond(500));

        FetchResponse response = client.call(URL, null);

        assertThat(response.status()).isEqualTo(500);
        assertThat(transport.attempts()).isEqualTo(1);
    }

    @Test
    void persistentServerErrorIsReturnedAfterAllAttempts() throws Exception {
        transport.always(respond(503, "{\"down\":true}"));

        FetchResponse response = client.call(URL, retrying(3, 1));

        assertThat(transport.attempts()).isEqualTo(4);
        assertThat(response.status()).isEqualTo(503);
        assertThat(response.text()).isEqualTo("{\"down\":true}");
    }

    @Test
    void serverErrorThenSuccessReturnsSuccess() throws Exception {
        transport.then(respond(502)).then(respond(503)).then(respond(200, "{}"));

        FetchResponse response = client.call(URL, retrying(5, 1));

        assertThat(response.status()).isEqualTo(200);
        assertThat(transport.attempts()).isEqualTo(3);
    }

    @Test
    void clientErrorIsNeverRetried() throws Exception {
        transport.always(respond(404));

        FetchResponse response = client.call(URL, retrying(3, 1));

        assertThat(response.status()).isEqualTo(404);
        assertThat(transport.attempts()).isEqualTo(1);
    }

    @Test
    void networkFailuresAreRetriedWithDelayAndLastErrorIsThrown() {
        transport.then(fail("refused 1")).then(fail("refused 2")).then(fail("refused 3"));

        assertThatThrownBy(() -> client.call(URL, retrying(2, 50)))
                .isInstanceOf(NetworkFailureException.class)
                .hasMessage("refused 3");

        assertThat(transport.attempts()).isEqualTo(3);
        for (int i = 1; i < transport.sendNanos.size(); i++) {
            long gap = transport.sendNanos.get(i) - transport.sendNanos.get(i - 1);
            assertThat(gap).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(50));
        }
    }

    @Test
    void networkFailureThenSuccess() throws Exception {
        transport.then(fail("reset")).then(respond(200));

        FetchResponse response = client.call(URL, retrying(1, 1));

        assertThat(response.status()).isEqualTo(200);
        assertThat(transport.attempts()).isEqualTo(2);
    }

    @Test
    void timeoutShorterThanLatencyIsClassifiedAsTimeout() {
        transport.always(hang());
        RequestOptions options = RequestOptions.builder().timeout(Duration.ofMillis(50)).build();

        RequestTimeoutException e = catchThrowableOfType(() -> client.call(URL, options), RequestTimeoutException.class);

        assertThat(e).hasMessage("Request timeout after 50ms");
        assertThat(e.timeout()).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void eachAttemptGetsItsOwnTimeout() {
        transport.always(hang());
        RequestOptions options = retrying(2, 1).toBuilder().timeout(Duration.ofMillis(30)).build();

        assertThatThrownBy(() -> client.call(URL, options)).isInstanceOf(RequestTimeoutException.class);
        assertThat(transport.attempts()).isEqualTo(3);
    }

    @Test
    void timeoutDoesNotFireAfterFastAttempt() throws Exception {
        transport.then(respond(503)).then(hang());
        RequestOptions options = retrying(1, 1).toBuilder().timeout(Duration.ofMillis(100)).build();

        // the second attempt hangs and must time out on its own timer
        long start = System.nanoTime();
        assertThatThrownBy(() -> client.call(URL, options))
                .isInstanceOf(RequestTimeoutException.class)
                .hasMessage("Request timeout after 100ms");
        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    void transportTimeoutIsClassifiedAsTimeout() {
        transport.always(timeOut());

        RequestTimeoutException e = catchThrowableOfType(() -> client.call(URL, null), RequestTimeoutException.class);

        assertThat(e).hasMessage("Request timeout");
        assertThat(e.timeout()).isNull();
    }

    @Test
    void callerCancellationIsRetriedAndSurfacedAsCancelled() throws Exception {
        transport.always(hang());
        CancellationController controller = new CancellationController();
        RequestOptions options = retrying(3, 1).toBuilder().signal(controller.token()).build();

        CompletableFuture<FetchResponse> future = client.callAsync(URL, options);
        assertThat(transport.entered.tryAcquire(5, TimeUnit.SECONDS)).isTrue();
        controller.cancel();

        ExecutionException e = catchThrowableOfType(() -> future.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(e.getCause())
                .isInstanceOf(RequestCancelledException.class)
                .hasMessage("Request aborted by user");
        assertThat(((RequestCancelledException) e.getCause()).cancelledBy())
                .isEqualTo(RequestCancelledException.CancelledBy.CALLER);
        assertThat(transport.attempts()).isEqualTo(4);
        assertThat(transport.exchanges()).isEqualTo(1);
    }

    @Test
    void alreadyCancelledSignalFailsWithoutExchange() {
        CancellationController controller = new CancellationController();
        controller.cancel();
        RequestOptions options = RequestOptions.builder().signal(controller.token()).build();

        assertThatThrownBy(() -> client.call(URL, options))
                .isInstanceOf(RequestCancelledException.class)
                .hasMessage("Request aborted by user");
        assertThat(transport.attempts()).isEqualTo(1);
        assertThat(transport.exchanges()).isZero();
        assertThat(inFlight()).isZero();
    }

    @Test
    void cancelledCallStillWaitsFullDelayBetweenAttempts() throws Exception {
        transport.always(fail("refused"));
        CancellationController controller = new CancellationController();
        RequestOptions options = retrying(2, 100).toBuilder().signal(controller.token()).build();

        CompletableFuture<FetchResponse> future = client.callAsync(URL, options);
        assertThat(transport.entered.tryAcquire(5, TimeUnit.SECONDS)).isTrue();
        controller.cancel();

        ExecutionException e = catchThrowableOfType(() -> future.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(e.getCause())
                .isInstanceOf(RequestCancelledException.class)
                .hasMessage("Request aborted by user");
        assertThat(transport.attempts()).isEqualTo(3);
        assertThat(transport.exchanges()).isEqualTo(1);
        for (int i = 1; i < transport.sendNanos.size(); i++) {
            long gap = transport.sendNanos.get(i) - transport.sendNanos.get(i - 1);
            assertThat(gap).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(100));
        }
    }

    @Test
    void cancelAllIsRetriedLikeOtherFailures() throws Exception {
        transport.always(hang());

        CompletableFuture<FetchResponse> future = client.callAsync(URL, retrying(1, 1));
        assertThat(transport.entered.tryAcquire(5, TimeUnit.SECONDS)).isTrue();
        client.cancelAll();

        ExecutionException e = catchThrowableOfType(() -> future.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(e.getCause()).hasMessage("Request aborted by abortAll()");
        assertThat(transport.attempts()).isEqualTo(2);
        assertThat(inFlight()).isZero();
    }

    @Test
    void recoveryHookReceivesIndexOfProducingAttempt() throws Exception {
        List<Integer> attempts = new ArrayList<>();
        client.configure(ClientConfig.builder()
                .onResponseError((response, attempt) -> {
                    attempts.add(attempt);
                    return null;
                })
                .build());
        transport.then(respond(503)).then(respond(503)).then(respond(401));

        FetchResponse response = client.call(URL, retrying(2, 1));

        assertThat(response.status()).isEqualTo(401);
        assertThat(attempts).containsExactly(2);
    }

    @Test
    void closedClientRejectsCalls() {
        client.close();

        assertThatThrownBy(() -> client.call(URL, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("SafeFetchClient is closed");
        assertThat(client.callAsync(URL, null)).isCompletedExceptionally();
        assertThat(transport.attempts()).isZero();
    }

    @Test
    void shutDownSchedulerFailsTimedCallWithCheckedException() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.shutdown();
        SafeFetchClient timed = SafeFetchClient.builder()
                .transport(transport)
                .jsonCodec(new JacksonJsonCodec())
                .scheduler(scheduler)
                .build();
        RequestOptions options = RequestOptions.builder().timeout(Duration.ofSeconds(1)).build();

        try {
            assertThatThrownBy(() -> timed.call(URL, options))
                    .isInstanceOf(SafeFetchException.class)
                    .hasMessageStartingWith("Cannot schedule request timeout");
            assertThat(((DefaultSafeFetchClient) timed).inFlight()).isZero();
            assertThat(transport.attempts()).isZero();
        } finally {
            timed.close();
        }
    }

    @Test
    void cancelAllFailsEveryInFlightCallAndEmptiesRegistry() throws Exception {
        transport.always(hang());

        CompletableFuture<FetchResponse> first = client.callAsync(URL + "/1", null);
        CompletableFuture<FetchResponse> second = client.callAsync(URL + "/2", null);
        assertThat(transport.entered.tryAcquire(2, 5, TimeUnit.SECONDS)).isTrue();

        assertThat(client.cancelAll()).isEqualTo(2);

        for (CompletableFuture<FetchResponse> future : List.of(first, second)) {
            ExecutionException e = catchThrowableOfType(() -> future.get(5, TimeUnit.SECONDS), ExecutionException.class);
            assertThat(e.getCause())
                    .isInstanceOf(RequestCancelledException.class)
                    .hasMessage("Request aborted by abortAll()");
        }
        assertThat(inFlight()).isZero();
        assertThat(client.cancelAll()).isZero();
    }

    @Test
    void cancelAllDoesNotAffectLaterCalls() throws Exception {
        client.cancelAll();
        transport.always(respond(200));

        assertThat(client.call(URL, null).status()).isEqualTo(200);
    }

    @Test
    void registryIsEmptyAfterSuccessAndFailure() throws Exception {
        transport.then(respond(200)).then(fail("down"));

        client.call(URL, null);
        assertThat(inFlight()).isZero();

        assertThatThrownBy(() -> client.call(URL, null)).isInstanceOf(NetworkFailureException.class);
        assertThat(inFlight()).isZero();
    }

    @Test
    void structuredBodyIsSerializedAsJson() throws Exception {
        RequestOptions options = RequestOptions.builder()
                .method("POST")
                .body(RequestBody.json(Map.of("name", "widget")))
                .build();

        client.call(URL, options);

        TransportRequest sent = transport.lastRequest();
        assertThat(sent.header("content-type")).isEqualTo("application/json");
        assertThat(sent.body()).isInstanceOf(RequestBody.Bytes.class);
        assertThat(new String(((RequestBody.Bytes) sent.body()).data(), StandardCharsets.UTF_8))
                .isEqualTo("{\"name\":\"widget\"}");
    }

    @Test
    void structuredBodyWithOtherContentTypeIsPassedThrough() throws Exception {
        RequestOptions options = RequestOptions.builder()
                .method("POST")
                .header("Content-Type", "text/plain")
                .body(RequestBody.json(List.of(1, 2)))
                .build();

        client.call(URL, options);

        TransportRequest sent = transport.lastRequest();
        assertThat(sent.header("Content-Type")).isEqualTo("text/plain");
        assertThat(sent.body()).isInstanceOf(RequestBody.Structured.class);
    }

    @Test
    void exactServerErrorHandlerOnlyFor500() throws Exception {
        List<String> calls = new ArrayList<>();
        client.configure(ClientConfig.builder()
                .onStatus(500, r -> calls.add("on500"))
                .onServerError(r -> calls.add("generic"))
                .build());
        transport.always(respond(500));

        client.call(URL, null);

        assertThat(calls).containsExactly("on500");
    }

    @Test
    void otherServerErrorsRunExactThenGenericHandler() throws Exception {
        List<String> calls = new ArrayList<>();
        client.configure(ClientConfig.builder()
                .onStatus(502, r -> calls.add("on502"))
                .onServerError(r -> calls.add("generic " + r.status()))
                .onResponse(r -> calls.add("onResponse"))
                .build());
        transport.then(respond(502)).then(respond(503));

        client.call(URL, null);
        client.call(URL, null);

        assertThat(calls).containsExactly("on502", "generic 502", "onResponse", "generic 503", "onResponse");
    }

    @Test
    void recoveredUnauthorizedResolvesWithSubstitute() throws Exception {
        List<Integer> attempts = new ArrayList<>();
        client.configure(ClientConfig.builder()
                .onResponseError((response, attempt) -> {
                    attempts.add(attempt);
                    return response.status() == 401 ? FetchResponse.of(200, "{\"refreshed\":true}") : null;
                })
                .build());
        transport.always(respond(401));

        FetchResponse response = client.call(URL, null);

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.text()).isEqualTo("{\"refreshed\":true}");
        assertThat(attempts).containsExactly(0);
    }

    @Test
    void recoveryHookSkippedForSuccessAndServerErrors() throws Exception {
        AtomicInteger invoked = new AtomicInteger();
        client.configure(ClientConfig.builder()
                .onResponseError((response, attempt) -> {
                    invoked.incrementAndGet();
                    return null;
                })
                .build());
        transport.then(respond(200)).then(respond(503)).then(respond(404));

        client.call(URL, null);
        client.call(URL, null);
        FetchResponse notFound = client.call(URL, null);

        assertThat(notFound.status()).isEqualTo(404);
        assertThat(invoked).hasValue(1);
    }

    @Test
    void requestHookRunsOncePerCallAcrossRetries() throws Exception {
        AtomicInteger invoked = new AtomicInteger();
        client.configure(ClientConfig.builder()
                .onRequest((url, options) -> {
                    invoked.incrementAndGet();
                    return options.toBuilder().header("Authorization", "Bearer t0k3n").build();
                })
                .build());
        transport.always(respond(503));

        client.call(URL, retrying(2, 1));

        assertThat(invoked).hasValue(1);
        assertThat(transport.requests)
                .hasSize(3)
                .allSatisfy(r -> assertThat(r.header("authorization")).isEqualTo("Bearer t0k3n"));
    }

    @Test
    void requestHookSeesResolvedUrlAndMergedHeaders() throws Exception {
        List<String> seen = new ArrayList<>();
        client.configure(ClientConfig.builder()
                .baseUrl("http://api.test/v1/")
                .header("Accept", "application/json")
                .header("X-Client", "default")
                .onRequest((url, options) -> {
                    seen.add(url.toString());
                    seen.add(options.headers().get("x-client"));
                    seen.add(options.headers().get("accept"));
                    return options;
                })
                .build());

        client.call("/items", RequestOptions.builder()
                .header("x-client", "call")
                .param("tag", List.of("a", "b"))
                .param("page", 2)
                .build());

        assertThat(seen).containsExactly("http://api.test/v1/items?tag=a&tag=b&page=2", "call", "application/json");
        assertThat(transport.lastRequest().uri().toString()).isEqualTo("http://api.test/v1/items?tag=a&tag=b&page=2");
    }

    @Test
    void relativeUrlWithoutBaseUrlIsRejected() {
        assertThatThrownBy(() -> client.call("/items", null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(transport.attempts()).isZero();
    }

    @Test
    void networkErrorHookObservesErrorBeforeItIsThrown() {
        List<SafeFetchException> observed = new CopyOnWriteArrayList<>();
        client.configure(ClientConfig.builder().onError(observed::add).build());
        transport.always(fail("unreachable"));

        SafeFetchException thrown = catchThrowableOfType(() -> client.call(URL, null), SafeFetchException.class);

        assertThat(observed).containsExactly(thrown);
    }

    @Test
    void failingNetworkErrorHookIsSuppressedIntoSurfacedError() {
        client.configure(ClientConfig.builder()
                .onError(e -> {
                    throw new IllegalStateException("hook broke");
                })
                .build());
        transport.always(fail("unreachable"));

        NetworkFailureException thrown = catchThrowableOfType(() -> client.call(URL, null), NetworkFailureException.class);

        assertThat(thrown).hasMessage("unreachable");
        assertThat(thrown.getSuppressed()).hasSize(1);
        assertThat(thrown.getSuppressed()[0]).hasMessage("hook broke");
    }

    @Test
    void networkErrorHookNotCalledWhenResponseObtained() throws Exception {
        AtomicInteger invoked = new AtomicInteger();
        client.configure(ClientConfig.builder().onError(e -> invoked.incrementAndGet()).build());
        transport.always(respond(503));

        client.call(URL, retrying(1, 1));

        assertThat(invoked).hasValue(0);
    }

    @Test
    void throwingRequestHookAbortsCall() {
        client.configure(ClientConfig.builder()
                .onRequest((url, options) -> {
                    throw new IllegalStateException("no credentials");
                })
                .build());

        assertThatThrownBy(() -> client.call(URL, null))
                .isInstanceOf(InterceptorException.class)
                .hasMessage("onRequest hook failed: no credentials");
        assertThat(transport.attempts()).isZero();
        assertThat(inFlight()).isZero();
    }

    @Test
    void throwingStatusHandlerAbortsCall() {
        client.configure(ClientConfig.builder()
                .onStatus(404, r -> {
                    throw new IllegalStateException("missing");
                })
                .build());
        transport.always(respond(404));

        assertThatThrownBy(() -> client.call(URL, null))
                .isInstanceOf(InterceptorException.class)
                .hasMessage("on404 hook failed: missing");
        assertThat(inFlight()).isZero();
    }

    @Test
    void configurationChangesApplyToLaterCalls() throws Exception {
        client.configure(ClientConfig.builder().baseUrl("http://one.test").build());
        client.call("/a", null);
        client.configure(ClientConfig.builder().baseUrl("http://two.test").build());
        client.call("/a", null);

        assertThat(transport.requests.get(0).uri().getHost()).isEqualTo("one.test");
        assertThat(transport.requests.get(1).uri().getHost()).isEqualTo("two.test");
    }
}
