package io.github.clickin.flatquery.core;

import java.util.Objects;

/**
 * A value written as one piece of text.
 *
 * <p>Parse failures surface as {@link FlatQueryException.InvalidLiteral} with the message
 * {@code invalid <name> literal} and the parser's exception as cause. Formatter failures surface
 * the same way with {@code invalid <name> value}.
 */
public final class ScalarShape<T> implements Shape<T> {

    /**
     * Renders a value as text.
     */
    @FunctionalInterface
    public interface Formatter<T> {
        String format(T value) throws Exception;
    }

    /**
     * Parses text into exactly the requested type.
     */
    @FunctionalInterface
    public interface Parser<T> {
        T parse(String text) throws Exception;
    }

    private final String name;
    private final Formatter<T> formatter;
    private final Parser<T> parser;

    ScalarShape(String name, Formatter<T> formatter, Parser<T> parser) {
        this.name = Objects.requireNonNull(name, "name");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public Kind kind() {
        return Kind.SCALAR;
    }

    @Override
    public String describe() {
        return name;
    }

    /**
     * Text form of {@code value}.
     */
    public String format(String key, T value) {
        Objects.requireNonNull(value, key);
        try {
            return formatter.format(value);
        } catch (FlatQueryException e) {
            throw e;
        } catch (Exception e) {
            throw new FlatQueryException.InvalidLiteral("invalid " + name + " value", key, e);
        }
    }

    /**
     * Parses {@code text} into a value.
     */
    public T parse(String key, String text) {
        try {
            return parser.parse(text);
        } catch (FlatQueryException e) {
            throw e;
        } catch (Exception e) {
            throw new FlatQueryException.InvalidLiteral("invalid " + name + " literal", key, e);
        }
    }

    @Override
    public void write(String key, T value, Encoder out) {
        out.pair(key, format(key, value));
    }

    @Override
    public T read(String key, Decoder in) {
        return parse(key, in.require(key));
    }

    @Override
    public String toString() {
        return "ScalarShape[" + name + "]";
    }
}
