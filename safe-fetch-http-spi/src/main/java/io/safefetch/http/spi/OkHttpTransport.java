package io.safefetch.http.spi;

import io.safefetch.core.CancellationToken;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link HttpTransport} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath. A fired token calls
 * {@link Call#cancel()} on the in-flight call.
 */
public final class OkHttpTransport implements HttpTransport {

    private static final byte[] EMPTY = new byte[0];

    private final OkHttpClient httpClient;

    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpTransport create() {
        return new OkHttpTransport(new OkHttpClient());
    }

    public static OkHttpTransport create(OkHttpClient httpClient) {
        return new OkHttpTransport(httpClient);
    }

    @Override
    public TransportResponse send(TransportRequest request, CancellationToken token) throws TransportException {
        if (token.isCancelled()) {
            throw TransportCancelledException.of(token);
        }

        Request okRequest;
        try {
            okRequest = toOkHttpRequest(request);
        } catch (IllegalArgumentException | IOException e) {
            throw new TransportException("Invalid request: " + e.getMessage(), e);
        }

        Call call = httpClient.newCall(okRequest);
        CancellationToken.Registration registration = token.onCancel(reason -> call.cancel());
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ? body.bytes() : EMPTY;
            Map<String, List<String>> headers = response.headers().toMultimap();
            return new TransportResponse(response.code(), headers, bytes);
        } catch (IOException e) {
            if (call.isCanceled() || token.isCancelled()) {
                throw TransportCancelledException.of(token, e);
            }
            if (e instanceof SocketTimeoutException) {
                throw new TransportTimeoutException(e);
            }
            throw new TransportException(e);
        } finally {
            registration.unregister();
        }
    }

    private static Request toOkHttpRequest(TransportRequest request) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        okhttp3.RequestBody body = null;
        if (request.body() != null) {
            String contentType = request.header("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = okhttp3.RequestBody.create(BodyEncoder.toBytes(request.body()), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "HEAD" -> builder.head();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "POST" -> builder.post(body != null ? body : okhttp3.RequestBody.create(EMPTY, null));
            case "PUT" -> builder.put(body != null ? body : okhttp3.RequestBody.create(EMPTY, null));
            case "PATCH" -> builder.patch(body != null ? body : okhttp3.RequestBody.create(EMPTY, null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }
}
