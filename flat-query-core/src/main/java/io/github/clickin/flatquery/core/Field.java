package io.github.clickin.flatquery.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * A named record field: its key, its shape and how to read it from the record.
 *
 * <p>Fields whose shape is record-kind are flattened: their own fields are written at the same
 * level as this one and {@link #name()} never appears on the wire.
 *
 * <pre>{@code
 * static final Field<Pagination, Integer> LIMIT = Field.of("limit", Scalars.I32, Pagination::limit);
 * }</pre>
 */
public final class Field<R, V> {
    private final String name;
    private final Shape<V> shape;
    private final Function<? super R, ? extends V> getter;

    private Field(String name, Shape<V> shape, Function<? super R, ? extends V> getter) {
        this.name = Objects.requireNonNull(name, "name");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.getter = Objects.requireNonNull(getter, "getter");
        if (name.isEmpty() || name.indexOf('&') >= 0 || name.indexOf('=') >= 0) {
            throw new IllegalArgumentException("invalid field name: '" + name + "'");
        }
    }

    public static <R, V> Field<R, V> of(String name, Shape<V> shape, Function<? super R, ? extends V> getter) {
        return new Field<>(name, shape, getter);
    }

    public String name() {
        return name;
    }

    public Shape<V> shape() {
        return shape;
    }

    void write(R record, Encoder out) {
        shape.write(name, getter.apply(record), out);
    }

    V read(Decoder in) {
        return shape.read(name, in);
    }

    boolean isPresent(Decoder in) {
        return shape.isPresent(name, in);
    }

    @Override
    public String toString() {
        return name + ": " + shape.describe();
    }
}
