package io.github.clickin.flatquery.json.spi;

/**
 * Raised by a {@link JsonCodec} when a value cannot be written as JSON or a document cannot be
 * read into the requested type. The library's own exception is kept as cause.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
