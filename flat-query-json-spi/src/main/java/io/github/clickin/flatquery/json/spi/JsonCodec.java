package io.github.clickin.flatquery.json.spi;

import java.util.List;

/**
 * Minimal JSON codec used to embed a whole list as one field value.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>flat-query only writes and reads JSON arrays of scalar values.
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
     * Deserializes a JSON array to a list of typed objects.
     * @param json JSON string (must be a JSON array)
     * @param elementType element class
     * @return list of deserialized objects
     * @throws JsonException if deserialization fails or the document is not an array
     */
    <T> List<T> readList(String json, Class<T> elementType) throws JsonException;
}
