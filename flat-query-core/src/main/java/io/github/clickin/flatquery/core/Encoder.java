package io.github.clickin.flatquery.core;

import io.github.clickin.flatquery.json.spi.JsonCodec;

/**
 * Output side of one encode call.
 *
 * <p>Shapes hand complete pairs to {@link #pair(String, String)}; nothing is written for a field
 * until its value is known, so absent optionals and empty sequences leave no trace.
 */
public final class Encoder {
    private final StringBuilder out = new StringBuilder();
    private final JsonCodec jsonCodec; // may be null
    private boolean first = true;

    Encoder(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    /**
     * Appends {@code key=value}, preceded by {@code &} unless it is the first pair.
     *
     * @throws FlatQueryException.Unsupported if {@code key} is null (a scalar outside any record)
     */
    public void pair(String key, String value) {
        if (key == null) {
            throw new FlatQueryException.Unsupported("value outside a record has no key");
        }
        if (!first) out.append('&');
        first = false;
        out.append(key).append('=').append(value);
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

    String result() {
        return out.toString();
    }
}
