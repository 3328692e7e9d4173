package io.github.clickin.flatquery.core;

import io.github.clickin.flatquery.json.spi.JsonCodec;

import java.util.Objects;

/**
 * Encoder and decoder for flat {@code key=value&key=value} text.
 *
 * <pre>{@code
 * FlatQuery codec = FlatQuery.builder()
 *     .rejectUnconsumed(true)
 *     .build();
 *
 * String text = codec.encode(Person.SHAPE, person);   // name=test&age=37&limit=10&offset=0
 * Person back = codec.decode(Person.SHAPE, text);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared; every call works on its own state.
 */
public final class FlatQuery {
    private final JsonCodec jsonCodec; // may be null
    private final boolean rejectUnconsumed;

    private FlatQuery(Builder b) {
        this.jsonCodec = b.jsonCodec != null ? b.jsonCodec : JsonCodecs.discover().orElse(null);
        this.rejectUnconsumed = b.rejectUnconsumed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Codec with ServiceLoader-discovered JSON support and lenient decoding.
     */
    public static FlatQuery defaults() {
        return builder().build();
    }

    /**
     * Encodes {@code value} as flat text.
     *
     * @param shape record-kind shape of the value
     * @throws FlatQueryException if the shape is not a record, a custom scalar cannot be formatted
     *                            or the JSON sub-codec fails
     */
    public <T> String encode(Shape<T> shape, T value) {
        requireRecord(shape);
        Objects.requireNonNull(value, "value");
        Encoder out = new Encoder(jsonCodec);
        shape.write(null, value, out);
        return out.result();
    }

    /**
     * Decodes flat text into a value of {@code shape}.
     *
     * @param shape record-kind shape of the target
     * @throws FlatQueryException on malformed text, missing required keys, unparsable literals,
     *                            JSON sub-codec failures and, in strict mode, unread input
     */
    public <T> T decode(Shape<T> shape, String text) {
        requireRecord(shape);
        Decoder in = new Decoder(FieldMap.parse(text), jsonCodec);
        T value = shape.read(null, in);
        if (rejectUnconsumed && !in.fields().isEmpty()) {
            throw new FlatQueryException.UnconsumedInput(in.fields().keys().iterator().next());
        }
        return value;
    }

    public boolean rejectsUnconsumed() {
        return rejectUnconsumed;
    }

    private static void requireRecord(Shape<?> shape) {
        Objects.requireNonNull(shape, "shape");
        if (shape.kind() != Shape.Kind.RECORD) {
            throw new FlatQueryException.Unsupported("top-level shape must be a record, got " + shape.describe());
        }
    }

    /**
     * Builder for {@link FlatQuery}.
     */
    public static final class Builder {
        private JsonCodec jsonCodec;
        private boolean rejectUnconsumed;

        private Builder() {}

        /**
         * JSON codec used by {@link Shape#array(Class)} fields. Defaults to the first
         * {@link io.github.clickin.flatquery.json.spi.JsonCodecProvider} found by ServiceLoader.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
            return this;
        }

        /**
         * When enabled, decoding fails if keys or surplus values are left unread. Default: false.
         */
        public Builder rejectUnconsumed(boolean rejectUnconsumed) {
            this.rejectUnconsumed = rejectUnconsumed;
            return this;
        }

        public FlatQuery build() {
            return new FlatQuery(this);
        }
    }
}
