package io.github.clickin.flatquery.core;

import io.github.clickin.flatquery.json.spi.JsonException;

import java.util.List;
import java.util.Objects;

final class ArrayShape<T> implements Shape<Array<T>> {
    private final Class<T> elementType;

    ArrayShape(Class<T> elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType");
    }

    // one value on the wire, whatever the element count
    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    @Override
    public String describe() {
        return "Array<" + elementType.getSimpleName() + ">";
    }

    @Override
    public void write(String key, Array<T> value, Encoder out) {
        Objects.requireNonNull(value, key);
        String json;
        try {
            json = out.jsonCodec(key).writeString(value.values());
        } catch (JsonException e) {
            throw new FlatQueryException.SubCodecFailure("cannot encode array", key, e);
        }
        out.pair(key, json);
    }

    @Override
    public Array<T> read(String key, Decoder in) {
        String text = in.require(key);
        if (text.isEmpty()) {
            throw new FlatQueryException.MissingValue(key);
        }
        List<T> values;
        try {
            values = in.jsonCodec(key).readList(text, elementType);
        } catch (JsonException e) {
            throw new FlatQueryException.SubCodecFailure("invalid array document", key, e);
        }
        if (values == null) {
            throw new FlatQueryException.SubCodecFailure("invalid array document", key,
                    new JsonException("document is null"));
        }
        for (T v : values) {
            if (v == null) {
                throw new FlatQueryException.SubCodecFailure("invalid array document", key,
                        new JsonException("null is not a valid " + elementType.getName() + " element"));
            }
        }
        return new Array<>(values);
    }

    @Override
    public boolean isPresent(String key, Decoder in) {
        String next = in.fields().peek(key);
        return next != null && !next.isEmpty();
    }

    // k= stands for an absent optional array
    @Override
    public void consumeAbsent(String key, Decoder in) {
        if ("".equals(in.fields().peek(key))) {
            in.fields().take(key);
        }
    }
}
