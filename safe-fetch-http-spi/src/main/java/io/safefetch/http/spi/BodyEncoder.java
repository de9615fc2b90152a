package io.safefetch.http.spi;

import io.safefetch.core.RequestBody;
import io.safefetch.core.Urls;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Turns a {@link RequestBody} into wire bytes for adapters that need them up front.
 */
public final class BodyEncoder {
    private BodyEncoder() {}

    /**
     * Encodes the body. {@link RequestBody.Stream} bodies are read fully.
     * {@link RequestBody.Structured} values that reach a transport were deliberately left
     * unserialized and are sent as their string form.
     *
     * @return the bytes, or null for a null body
     */
    public static byte[] toBytes(RequestBody body) throws IOException {
        if (body == null) return null;
        if (body instanceof RequestBody.Bytes) {
            return ((RequestBody.Bytes) body).data();
        }
        if (body instanceof RequestBody.Text) {
            return ((RequestBody.Text) body).utf8();
        }
        if (body instanceof RequestBody.Stream) {
            try (InputStream in = ((RequestBody.Stream) body).supplier().get()) {
                return in == null ? new byte[0] : in.readAllBytes();
            }
        }
        if (body instanceof RequestBody.UrlEncoded) {
            return urlEncoded((RequestBody.UrlEncoded) body).getBytes(StandardCharsets.UTF_8);
        }
        if (body instanceof RequestBody.Form) {
            return multipart((RequestBody.Form) body);
        }
        return String.valueOf(((RequestBody.Structured) body).value()).getBytes(StandardCharsets.UTF_8);
    }

    public static String urlEncoded(RequestBody.UrlEncoded body) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> pair : body.pairs()) {
            if (sb.length() > 0) sb.append('&');
            sb.append(Urls.encode(pair.getKey())).append('=').append(Urls.encode(pair.getValue()));
        }
        return sb.toString();
    }

    public static byte[] multipart(RequestBody.Form form) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String dash = "--" + form.boundary();
        for (Map.Entry<String, String> field : form.fields().entrySet()) {
            write(out, dash + "\r\n");
            write(out, "Content-Disposition: form-data; name=\"" + escape(field.getKey()) + "\"\r\n\r\n");
            write(out, field.getValue() + "\r\n");
        }
        write(out, dash + "--\r\n");
        return out.toByteArray();
    }

    private static String escape(String name) {
        return name.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private static void write(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }
}
