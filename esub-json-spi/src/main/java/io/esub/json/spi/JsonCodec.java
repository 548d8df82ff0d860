package io.esub.json.spi;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Use strongly-typed records for the wire objects; no tree model is exposed.
 */
public interface JsonCodec {

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Deserializes a JSON string to a typed object.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;
}
