package io.safefetch.http.spi;

import java.util.List;
import java.util.Map;

/**
 * What a transport got back from the server.
 *
 * @param status the status code
 * @param headers response headers
 * @param body the body bytes, empty when the response had none
 */
public record TransportResponse(int status, Map<String, List<String>> headers, byte[] body) {
    public TransportResponse {
        if (headers == null) {
            headers = Map.of();
        }
        if (body == null) {
            body = new byte[0];
        }
    }
}
