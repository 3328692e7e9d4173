package io.github.clickin.flatquery.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 *
 * <p>Modules such as {@code flat-query-json-jackson} register implementations
 * via {@code META-INF/services}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
