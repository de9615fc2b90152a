package io.safefetch.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.safefetch.json.spi.JsonCodec;
import io.safefetch.json.spi.JsonException;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + typeName(value) + " to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + typeName(value) + " to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
