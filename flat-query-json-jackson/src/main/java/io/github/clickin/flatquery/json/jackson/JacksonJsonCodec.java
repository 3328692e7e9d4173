package io.github.clickin.flatquery.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.clickin.flatquery.json.spi.JsonCodec;
import io.github.clickin.flatquery.json.spi.JsonException;

import java.util.List;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 *
 * <p>The default mapper rejects trailing content after the document ({@code [1,2]x}) and
 * fractional numbers bound to integer elements ({@code [1.5]} as {@code Integer}).
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with {@link #defaultMapper()}.
     */
    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Mapper used by the no-arg constructor: Jackson defaults plus
     * {@link DeserializationFeature#FAIL_ON_TRAILING_TOKENS}, without
     * {@link DeserializationFeature#ACCEPT_FLOAT_AS_INT}.
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .build();
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + typeName(value) + " to JSON", e);
        }
    }

    @Override
    public <T> List<T> readList(String json, Class<T> elementType) throws JsonException {
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            return mapper.readValue(json, listType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize JSON array of " + elementType.getName(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
