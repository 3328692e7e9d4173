package io.github.clickin.flatquery.core;

/**
 * Failure raised while encoding or decoding flat query text.
 *
 * <p>Every failure of the codec is a {@code FlatQueryException}; the nested subclasses name the
 * category so that adapters can react to a specific one while still catching the base class.
 * The original cause (a {@link NumberFormatException}, a JSON codec failure) is preserved.
 */
public class FlatQueryException extends RuntimeException {

    private final String key;

    public FlatQueryException(String message) {
        this(message, null, null);
    }

    public FlatQueryException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public FlatQueryException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * The key being read or written when the failure happened, or {@code null} when the failure is
     * not tied to one key.
     */
    public String key() {
        return key;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getName()).append(": ").append(getMessage());
        if (key != null) {
            sb.append(" (key '").append(key).append("')");
        }
        if (getCause() != null) {
            sb.append(": ").append(getCause().getMessage());
        }
        return sb.toString();
    }

    /**
     * Raised when a {@code &}-separated piece is not exactly one {@code key=value} pair.
     * {@link #key()} holds the offending piece.
     */
    public static class InvalidPair extends FlatQueryException {
        public InvalidPair(String piece) {
            super("invalid pair", piece, null);
        }
    }

    /**
     * Raised when a required field has no value left in the input.
     */
    public static class MissingValue extends FlatQueryException {
        public MissingValue(String key) {
            super("no value", key, null);
        }
    }

    /**
     * Raised when a scalar cannot be parsed as, or formatted from, the requested type.
     */
    public static class InvalidLiteral extends FlatQueryException {
        public InvalidLiteral(String message, String key, Throwable cause) {
            super(message, key, cause);
        }
    }

    /**
     * Raised when a shape asks for something the codec does not implement.
     */
    public static class Unsupported extends FlatQueryException {
        public Unsupported(String message) {
            super(message);
        }

        public Unsupported(String message, String key) {
            super(message, key, null);
        }
    }

    /**
     * Raised when the JSON sub-codec behind an array field fails.
     */
    public static class SubCodecFailure extends FlatQueryException {
        public SubCodecFailure(String message, String key, Throwable cause) {
            super(message, key, cause);
        }
    }

    /**
     * Raised by strict decoding when input is left over after the target was populated.
     */
    public static class UnconsumedInput extends FlatQueryException {
        public UnconsumedInput(String key) {
            super("unexpected key", key, null);
        }
    }
}
