package io.github.clickin.flatquery.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Record made of ordered named fields.
 *
 * <p>Encoding writes the fields in declaration order. Decoding reads them in declaration order,
 * each by name, so the order of keys in the text does not matter; the decoded values are then
 * handed to the constructor function. A nested record is flattened: its fields share the
 * enclosing key space without any prefix.
 *
 * <pre>{@code
 * static final Field<Pagination, Integer> LIMIT = Field.of("limit", Scalars.I32, Pagination::limit);
 * static final Field<Pagination, Integer> OFFSET = Field.of("offset", Scalars.I32, Pagination::offset);
 *
 * static final RecordShape<Pagination> SHAPE = RecordShape.<Pagination>builder("Pagination")
 *     .field(LIMIT)
 *     .field(OFFSET)
 *     .build(v -> new Pagination(v.get(LIMIT), v.get(OFFSET)));
 * }</pre>
 *
 * <p>When two flattened records declare the same key, the field declared first takes the first
 * value of that key and the next one takes the following value.
 */
public final class RecordShape<T> implements Shape<T> {
    private final String name;
    private final List<Field<T, ?>> fields;
    private final List<String> fieldNames;
    private final Function<Values, T> constructor;

    private RecordShape(String name, List<Field<T, ?>> fields, Function<Values, T> constructor) {
        this.name = name;
        this.fields = List.copyOf(fields);
        this.constructor = constructor;
        List<String> names = new ArrayList<>(fields.size());
        for (Field<T, ?> f : fields) names.add(f.name());
        this.fieldNames = List.copyOf(names);
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * Own field names in declaration order. Names of flattened fields are included as declared;
     * their nested keys are not.
     */
    public List<String> fieldNames() {
        return fieldNames;
    }

    public List<Field<T, ?>> fields() {
        return fields;
    }

    @Override
    public Kind kind() {
        return Kind.RECORD;
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public void write(String key, T value, Encoder out) {
        Objects.requireNonNull(value, key == null ? name : key);
        for (Field<T, ?> f : fields) {
            f.write(value, out);
        }
    }

    @Override
    public T read(String key, Decoder in) {
        Map<Field<?, ?>, Object> decoded = new IdentityHashMap<>();
        for (Field<T, ?> f : fields) {
            decoded.put(f, f.read(in));
        }
        try {
            return constructor.apply(new Values(name, decoded));
        } catch (IllegalArgumentException e) {
            throw new FlatQueryException("invalid " + name + " record", key, e);
        }
    }

    @Override
    public boolean isPresent(String key, Decoder in) {
        for (Field<T, ?> f : fields) {
            if (f.isPresent(in)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "RecordShape[" + name + fields + "]";
    }

    /**
     * Decoded field values handed to the record constructor.
     */
    public static final class Values {
        private final String record;
        private final Map<Field<?, ?>, Object> decoded;

        private Values(String record, Map<Field<?, ?>, Object> decoded) {
            this.record = record;
            this.decoded = decoded;
        }

        @SuppressWarnings("unchecked")
        public <V> V get(Field<?, V> field) {
            if (!decoded.containsKey(field)) {
                throw new IllegalStateException("field '" + field.name() + "' is not declared by " + record);
            }
            return (V) decoded.get(field);
        }
    }

    /**
     * Builder collecting fields in declaration order.
     */
    public static final class Builder<T> {
        private final String name;
        private final List<Field<T, ?>> fields = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        /**
         * Appends a field.
         *
         * @throws IllegalArgumentException if this record already declares the name
         */
        public Builder<T> field(Field<T, ?> field) {
            Objects.requireNonNull(field, "field");
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("duplicate field '" + field.name() + "' in " + name);
            }
            fields.add(field);
            return this;
        }

        public RecordShape<T> build(Function<Values, T> constructor) {
            return new RecordShape<>(name, fields, Objects.requireNonNull(constructor, "constructor"));
        }
    }
}
