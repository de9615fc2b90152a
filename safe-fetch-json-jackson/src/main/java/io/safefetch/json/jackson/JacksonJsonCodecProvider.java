package io.safefetch.json.jackson;

import io.safefetch.json.spi.JsonCodec;
import io.safefetch.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}
