package io.safefetch.http.spi;

import io.safefetch.core.CancellationToken;
import io.safefetch.core.RequestBody;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link HttpTransport} implementation using Apache HttpClient 5.
 *
 * <p>Requires {@code org.apache.httpcomponents.client5:httpclient5} on the classpath. A fired
 * token aborts the request through {@link HttpUriRequestBase#cancel()}.
 */
public final class ApacheHttpTransport implements HttpTransport {

    private final CloseableHttpClient httpClient;

    public ApacheHttpTransport(CloseableHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static ApacheHttpTransport create() {
        return new ApacheHttpTransport(HttpClients.createDefault());
    }

    public static ApacheHttpTransport create(CloseableHttpClient httpClient) {
        return new ApacheHttpTransport(httpClient);
    }

    @Override
    public TransportResponse send(TransportRequest request, CancellationToken token) throws TransportException {
        if (token.isCancelled()) {
            throw TransportCancelledException.of(token);
        }

        HttpUriRequestBase apacheRequest;
        try {
            apacheRequest = toApacheRequest(request);
        } catch (IllegalArgumentException | IOException e) {
            throw new TransportException("Invalid request: " + e.getMessage(), e);
        }

        CancellationToken.Registration registration = token.onCancel(reason -> apacheRequest.cancel());
        try {
            return httpClient.execute(apacheRequest, response -> {
                byte[] body = response.getEntity() != null
                        ? EntityUtils.toByteArray(response.getEntity())
                        : null;
                return new TransportResponse(response.getCode(), headers(response.getHeaders()), body);
            });
        } catch (IOException e) {
            if (apacheRequest.isCancelled() || token.isCancelled()) {
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

    private static HttpUriRequestBase toApacheRequest(TransportRequest request) throws IOException {
        HttpUriRequestBase apacheRequest = new HttpUriRequestBase(request.method(), request.uri());

        RequestBody body = request.body();
        if (body instanceof RequestBody.Stream) {
            apacheRequest.setEntity(new InputStreamEntity(((RequestBody.Stream) body).supplier().get(), -1, null));
        } else if (body != null) {
            apacheRequest.setEntity(new ByteArrayEntity(BodyEncoder.toBytes(body), null));
        }

        request.headers().forEach(apacheRequest::setHeader);
        return apacheRequest;
    }

    private static Map<String, List<String>> headers(Header[] headers) {
        Map<String, List<String>> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Header h : headers) {
            out.computeIfAbsent(h.getName(), k -> new ArrayList<>()).add(h.getValue());
        }
        return out;
    }
}
