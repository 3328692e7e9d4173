package io.github.clickin.flatquery.core;

import java.util.Objects;
import java.util.Optional;

final class OptionalShape<T> implements Shape<Optional<T>> {
    private final Shape<T> inner;

    OptionalShape(Shape<T> inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public Kind kind() {
        return Kind.OPTIONAL;
    }

    @Override
    public String describe() {
        return "Optional<" + inner.describe() + ">";
    }

    @Override
    public void write(String key, Optional<T> value, Encoder out) {
        Objects.requireNonNull(value, key);
        if (value.isPresent()) {
            inner.write(key, value.get(), out);
        }
    }

    @Override
    public Optional<T> read(String key, Decoder in) {
        if (!inner.isPresent(key, in)) {
            inner.consumeAbsent(key, in);
            return Optional.empty();
        }
        return Optional.of(inner.read(key, in));
    }

    @Override
    public void consumeAbsent(String key, Decoder in) {
        inner.consumeAbsent(key, in);
    }

    @Override
    public boolean isPresent(String key, Decoder in) {
        return inner.isPresent(key, in);
    }
}
