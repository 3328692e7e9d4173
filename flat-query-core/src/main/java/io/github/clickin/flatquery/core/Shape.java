package io.github.clickin.flatquery.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Describes how values of {@code T} are laid out in flat text.
 *
 * <p>A shape both writes a value ({@link #write}) and rebuilds one from the remaining input
 * ({@link #read}), so user types take part in encoding and decoding without reflection. The
 * {@code key} argument is the name of the enclosing record field; record-kind shapes ignore it
 * because their fields are merged into the enclosing namespace.
 *
 * <p>Built-in shapes:
 * <ul>
 *   <li>{@link Scalars} for primitives, strings, byte arrays and enums</li>
 *   <li>{@link #optional(Shape)}, {@link #repeated(Shape)}, {@link #array(Class)}</li>
 *   <li>{@link RecordShape} for records, {@link #stringMap()} for open string maps</li>
 * </ul>
 *
 * <p>Implementations must be immutable.
 */
public interface Shape<T> {

    /**
     * Capability a shape exposes to the codec.
     */
    enum Kind {
        SCALAR,
        OPTIONAL,
        SEQUENCE,
        RECORD
    }

    Kind kind();

    /**
     * Short type description used in error messages (e.g. {@code i32}, {@code Optional<i32>}).
     */
    String describe();

    /**
     * Writes {@code value} under {@code key}.
     */
    void write(String key, T value, Encoder out);

    /**
     * Rebuilds a value from the input left in {@code in}, consuming what it reads.
     */
    T read(String key, Decoder in);

    /**
     * Returns true if {@code in} still holds input this shape would read under {@code key}.
     */
    default boolean isPresent(String key, Decoder in) {
        return in.fields().has(key);
    }

    /**
     * Called in place of {@link #read} when an optional field of this shape is absent. Consumes
     * any input that encodes the absence, such as an empty value. Does nothing by default.
     */
    default void consumeAbsent(String key, Decoder in) {
    }

    /**
     * Field that may be absent. Absent values produce no key at all.
     */
    static <T> Shape<Optional<T>> optional(Shape<T> inner) {
        return new OptionalShape<>(inner);
    }

    /**
     * List written as one {@code key=value} pair per element.
     */
    static <T> Shape<List<T>> repeated(Shape<T> element) {
        return new RepeatedShape<>(element);
    }

    /**
     * List written as a single key holding a JSON array.
     */
    static <T> Shape<Array<T>> array(Class<T> elementType) {
        return new ArrayShape<>(elementType);
    }

    /**
     * Open record of string values. As the last field of a record it collects every key the
     * other fields left unread.
     */
    static Shape<Map<String, String>> stringMap() {
        return StringMapShape.INSTANCE;
    }
}
