package io.github.clickin.flatquery.json.jackson;

import io.github.clickin.flatquery.json.spi.JsonCodec;
import io.github.clickin.flatquery.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}
