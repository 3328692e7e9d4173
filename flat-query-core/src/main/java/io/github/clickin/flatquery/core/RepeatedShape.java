package io.github.clickin.flatquery.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Repeated-key sequence: {@code ids=1&ids=2&ids=3}.
 */
final class RepeatedShape<T> implements Shape<List<T>> {
    private final Shape<T> element;

    RepeatedShape(Shape<T> element) {
        this.element = Objects.requireNonNull(element, "element");
        // the inner sequence would swallow every value of the key, so nesting cannot round trip
        if (element.kind() == Kind.SEQUENCE) {
            throw new FlatQueryException.Unsupported("repeated sequence of " + element.describe());
        }
    }

    @Override
    public Kind kind() {
        return Kind.SEQUENCE;
    }

    @Override
    public String describe() {
        return "List<" + element.describe() + ">";
    }

    @Override
    public void write(String key, List<T> value, Encoder out) {
        Objects.requireNonNull(value, key);
        for (T e : value) {
            element.write(key, Objects.requireNonNull(e, key), out);
        }
    }

    @Override
    public List<T> read(String key, Decoder in) {
        List<T> out = new ArrayList<>();
        while (element.isPresent(key, in)) {
            int before = in.fields().remaining();
            out.add(element.read(key, in));
            if (in.fields().remaining() == before) {
                throw new FlatQueryException.Unsupported("sequence element " + element.describe() + " consumed no input", key);
            }
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public boolean isPresent(String key, Decoder in) {
        return element.isPresent(key, in);
    }
}
