package io.safefetch.json.spi;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/io.safefetch.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    JsonCodec codec();

    /**
     * Returns the codec of the first provider found on the class path.
     * @return the codec, or empty when no provider is installed
     */
    static Optional<JsonCodec> discover() {
        return discover(JsonCodecProvider.class.getClassLoader());
    }

    static Optional<JsonCodec> discover(ClassLoader classLoader) {
        for (JsonCodecProvider provider : ServiceLoader.load(JsonCodecProvider.class, classLoader)) {
            return Optional.of(provider.codec());
        }
        return Optional.empty();
    }
}
