package io.safefetch.json.spi;

/**
 * Minimal JSON codec used to serialize structured request bodies and decode JSON responses.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the data is not valid JSON for {@code type}
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON string to a typed object.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if the string is not valid JSON for {@code type}
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;
}
