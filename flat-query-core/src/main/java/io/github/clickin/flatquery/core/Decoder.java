package io.github.clickin.flatquery.core;

import io.github.clickin.flatquery.json.spi.JsonCodec;

import java.util.Objects;

/**
 * Input side of one decode call: the {@link FieldMap} being consumed plus the JSON codec for
 * array fields.
 *
 * <p>Every nested read works on the same map, so a flattened record looks its field names up
 * against the whole key space.
 */
public final class Decoder {
    private final FieldMap fields;
    private final JsonCodec jsonCodec; // may be null

    Decoder(FieldMap fields, JsonCodec jsonCodec) {
        this.fields = Objects.requireNonNull(fields, "fields");
        this.jsonCodec = jsonCodec;
    }

    public FieldMap fields() {
        return fields;
    }

    /**
     * Consumes the next value for {@code key}.
     *
     * @throws FlatQueryException.MissingValue if the key has no value left
     */
    public String require(String key) {
        if (key == null) {
            throw new FlatQueryException.Unsupported("value outside a record has no key");
        }
        String v = fields.take(key);
        if (v == null) {
            throw new FlatQueryException.MissingValue(key);
        }
        return v;
    }

    /**
     * JSON codec for array fields.
     *
     * @throws FlatQueryException.Unsupported if none is configured or discoverable
     */
    public JsonCodec jsonCodec(String key) {
        if (jsonCodec == null) {
            throw new FlatQueryException.Unsupported("no JSON codec available for array fields", key);
        }
        return jsonCodec;
    }
}
