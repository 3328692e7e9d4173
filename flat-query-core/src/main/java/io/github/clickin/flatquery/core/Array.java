package io.github.clickin.flatquery.core;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * List written as a single key holding a JSON array ({@code ids=["1","2","3"]}) instead of one
 * pair per element.
 *
 * @param values the elements, never null and free of null elements
 */
public record Array<T>(List<T> values) implements Iterable<T> {

    public Array {
        values = List.copyOf(Objects.requireNonNull(values, "values"));
    }

    @SafeVarargs
    public static <T> Array<T> of(T... values) {
        return new Array<>(List.of(values));
    }

    public int size() {
        return values.size();
    }

    public T get(int index) {
        return values.get(index);
    }

    @Override
    public Iterator<T> iterator() {
        return values.iterator();
    }
}
